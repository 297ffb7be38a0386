package com.company.alerting.service;

import com.company.alerting.domain.Incident;

import java.util.Collection;

/**
 * Delivers a page to the responders of one escalation level.
 */
public interface ResponderPager {

    void page(Incident incident, int level, Collection<String> userIds);
}
