package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.domain.AlertKind;
import com.phillippitts.grillstats.domain.AlertRule;
import com.phillippitts.grillstats.service.alert.AlertEvaluator;
import com.phillippitts.grillstats.service.alert.AlertRuleRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Collection;

/**
 * Alert rules in force. Replacing or removing a rule drops the alert state kept for it.
 */
@RestController
@RequestMapping("/api/alert-rules")
class AlertRuleController {

    private final AlertRuleRegistry registry;
    private final AlertEvaluator evaluator;

    AlertRuleController(AlertRuleRegistry registry, AlertEvaluator evaluator) {
        this.registry = registry;
        this.evaluator = evaluator;
    }

    @GetMapping
    Collection<AlertRule> list() {
        return registry.rules();
    }

    @PostMapping
    ResponseEntity<AlertRule> register(@Valid @RequestBody AlertRuleRequest request) {
        AlertRule rule = request.toRule();
        boolean replaced = registry.register(rule).isPresent();
        if (replaced) {
            evaluator.forgetRule(rule.id());
        }
        return ResponseEntity.status(replaced ? HttpStatus.OK : HttpStatus.CREATED).body(rule);
    }

    @DeleteMapping("/{ruleId}")
    ResponseEntity<Void> remove(@PathVariable String ruleId) {
        if (registry.remove(ruleId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        evaluator.forgetRule(ruleId);
        return ResponseEntity.noContent().build();
    }

    record AlertRuleRequest(@NotBlank String id,
                            @NotBlank String deviceId,
                            String channelId,
                            @NotNull AlertKind kind,
                            double threshold,
                            Double upperThreshold,
                            Long debounceSeconds) {

        AlertRule toRule() {
            Duration debounce = Duration.ofSeconds(debounceSeconds == null ? 0 : debounceSeconds);
            return new AlertRule(id, deviceId, channelId, kind, threshold, debounce, upperThreshold);
        }
    }
}
