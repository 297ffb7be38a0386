package com.company.alerting.service;

import com.company.alerting.domain.EscalationPolicy;
import com.company.alerting.domain.ServiceMapping;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.repository.EscalationPolicyRepository;
import com.company.alerting.repository.ServiceMappingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscalationPolicyResolverTest {

    @Mock
    private ServiceMappingRepository mappingRepository;

    @Mock
    private EscalationPolicyRepository policyRepository;

    @InjectMocks
    private EscalationPolicyResolver resolver;

    @Test
    void first_matching_mapping_in_priority_order_wins() {
        List<ServiceMapping> ordered = List.of(
                mapping(1L, "payment-*", List.of("critical"), 10L),
                mapping(2L, "payment-*", null, 20L),
                mapping(3L, "*", null, 30L));

        assertThat(EscalationPolicyResolver.findMapping(ordered, "payment-api", Severity.CRITICAL))
                .map(ServiceMapping::getId).contains(1L);
        assertThat(EscalationPolicyResolver.findMapping(ordered, "payment-api", Severity.WARNING))
                .map(ServiceMapping::getId).contains(2L);
        assertThat(EscalationPolicyResolver.findMapping(ordered, "auth-service", Severity.CRITICAL))
                .map(ServiceMapping::getId).contains(3L);
    }

    @Test
    void missing_service_only_matches_wildcard() {
        List<ServiceMapping> ordered = List.of(mapping(1L, "payment-*", null, 10L));

        assertThat(EscalationPolicyResolver.findMapping(ordered, null, Severity.HIGH)).isEmpty();
        assertThat(EscalationPolicyResolver.findMapping(List.of(mapping(2L, "*", null, 10L)), null, Severity.HIGH))
                .isPresent();
    }

    @Test
    void resolve_loads_mapped_policy() {
        EscalationPolicy policy = EscalationPolicy.builder().id(10L).name("payments").build();
        when(mappingRepository.findAllOrdered()).thenReturn(List.of(mapping(1L, "payment-*", null, 10L)));
        when(policyRepository.findById(10L)).thenReturn(policy);

        assertThat(resolver.resolve("payment-api", Severity.HIGH)).contains(policy);
    }

    @Test
    void dangling_mapping_falls_through_to_next_match() {
        EscalationPolicy fallback = EscalationPolicy.builder().id(30L).name("default").build();
        when(mappingRepository.findAllOrdered()).thenReturn(List.of(
                mapping(1L, "payment-*", null, 99L),
                mapping(2L, "auth-*", null, 20L),
                mapping(3L, "*", null, 30L)));
        when(policyRepository.findById(99L)).thenReturn(null);
        when(policyRepository.findById(30L)).thenReturn(fallback);

        assertThat(resolver.resolve("payment-api", Severity.HIGH)).contains(fallback);
    }

    @Test
    void only_dangling_mappings_resolve_to_nothing() {
        when(mappingRepository.findAllOrdered()).thenReturn(List.of(mapping(1L, "*", null, 99L)));
        when(policyRepository.findById(99L)).thenReturn(null);

        assertThat(resolver.resolve("payment-api", Severity.HIGH)).isEqualTo(Optional.empty());
    }

    private static ServiceMapping mapping(Long id, String pattern, List<String> severities, Long policyId) {
        return ServiceMapping.builder()
                .id(id)
                .servicePattern(pattern)
                .severityFilter(severities)
                .escalationPolicyId(policyId)
                .priority(100)
                .build();
    }
}
