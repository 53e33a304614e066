package com.company.workflowsla.service;

import com.company.workflowsla.bus.Event;
import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.bus.EventHandler;
import com.company.workflowsla.event.WorkflowEvents;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bus subscriber that hands breach alerts and escalations to the outbound alert channel.
 * Each forwarded event is recorded as a span with the event payload attached.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "workflow.alerts.forwarding.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertNotificationForwarder {

    static final List<String> FORWARDED_TOPICS =
            List.of(WorkflowEvents.SLA_BREACH, WorkflowEvents.APPROVAL_ESCALATED);

    private final EventBus eventBus;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final EventHandler handler = this::forward;

    public AlertNotificationForwarder(EventBus eventBus, Tracer tracer, MeterRegistry meterRegistry) {
        this.eventBus = eventBus;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void subscribe() {
        FORWARDED_TOPICS.forEach(topic -> eventBus.subscribe(topic, handler));
        log.info("Forwarding {} to the outbound alert channel", FORWARDED_TOPICS);
    }

    @PreDestroy
    public void unsubscribe() {
        FORWARDED_TOPICS.forEach(topic -> eventBus.unsubscribe(topic, handler));
    }

    void forward(Event event) {
        Span span = tracer.spanBuilder("workflow.alert.forward")
                .setSpanKind(SpanKind.PRODUCER)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("event.type", event.getType());
            span.setAttribute("event.timestamp", event.getTimestamp());

            if (WorkflowEvents.SLA_BREACH.equals(event.getType())) {
                span.setAttribute("sla.id", String.valueOf(event.getData().get("sla_id")));
                span.setAttribute("execution.id", String.valueOf(event.getData().get("execution_id")));
                span.setAttribute("severity", String.valueOf(event.getData().get("severity")));
                span.addEvent("SLA Breach Alert",
                        Attributes.of(
                                AttributeKey.longKey("breach_margin_ms"), asLong(event.getData().get("breach_margin_ms")),
                                AttributeKey.stringKey("recipients"), String.valueOf(event.getData().get("recipients"))
                        ));
                log.info("Forwarded {} breach alert for SLA {} execution {} to {}",
                        event.getData().get("severity"), event.getData().get("sla_id"),
                        event.getData().get("execution_id"), event.getData().get("recipients"));
            } else {
                span.setAttribute("approval.id", String.valueOf(event.getData().get("approval_id")));
                span.addEvent("Approval Escalated",
                        Attributes.of(
                                AttributeKey.stringKey("escalated_to_role"),
                                String.valueOf(event.getData().get("escalated_to_role"))
                        ));
                log.info("Forwarded escalation of approval {} to role {}",
                        event.getData().get("approval_id"), event.getData().get("escalated_to_role"));
            }

            meterRegistry.counter("workflow.alerts.forwarded", "type", event.getType()).increment();

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to forward alert");
            throw e;
        } finally {
            span.end();
        }
    }

    private static long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
