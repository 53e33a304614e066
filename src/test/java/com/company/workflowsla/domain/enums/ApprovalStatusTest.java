package com.company.workflowsla.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApprovalStatus")
class ApprovalStatusTest {

    @Test
    @DisplayName("Should allow every forced and human transition out of PENDING")
    void shouldLeavePendingAnywhere() {
        assertThat(ApprovalStatus.PENDING.allowedTransitions())
                .containsExactlyInAnyOrder(ApprovalStatus.APPROVED, ApprovalStatus.DENIED,
                        ApprovalStatus.ESCALATED, ApprovalStatus.EXPIRED);
    }

    @Test
    @DisplayName("Should never move an escalated approval back to pending or escalate it again")
    void shouldOnlyMoveForwardFromEscalated() {
        assertThat(ApprovalStatus.ESCALATED.canTransitionTo(ApprovalStatus.PENDING)).isFalse();
        assertThat(ApprovalStatus.ESCALATED.canTransitionTo(ApprovalStatus.ESCALATED)).isFalse();
        assertThat(ApprovalStatus.ESCALATED.canTransitionTo(ApprovalStatus.EXPIRED)).isTrue();
        assertThat(ApprovalStatus.ESCALATED.canTransitionTo(ApprovalStatus.APPROVED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ApprovalStatus.class, names = {"APPROVED", "DENIED", "EXPIRED"})
    @DisplayName("Should treat terminal states as final")
    void shouldHaveNoTransitionsFromTerminal(ApprovalStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.isResolvable()).isFalse();
        assertThat(status.allowedTransitions()).isEmpty();
    }

    @Test
    @DisplayName("Should parse stored values case-insensitively")
    void shouldParse() {
        assertThat(ApprovalStatus.fromString("escalated")).isEqualTo(ApprovalStatus.ESCALATED);
        assertThat(ApprovalStatus.EXPIRED.value()).isEqualTo("expired");
    }
}
