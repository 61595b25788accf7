package com.notisync.device.api;

import com.notisync.common.rules.RuleDocument;
import com.notisync.device.model.RuleTriggerStats;
import com.notisync.device.service.ClientRuleService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/rules")
@RequiredArgsConstructor
public class RuleController {

  private final ClientRuleService ruleService;

  /** Seeds the default rule set on first use. */
  @GetMapping
  public ResponseEntity<List<RuleDocument>> list() {
    return ResponseEntity.ok(ruleService.rules().stream().map(ruleService::toDocument).toList());
  }

  @GetMapping("/stats")
  public ResponseEntity<List<RuleTriggerStats>> stats() {
    return ResponseEntity.ok(ruleService.triggerStats());
  }

  @GetMapping("/{id}")
  public ResponseEntity<RuleDocument> get(@PathVariable("id") String id) {
    return ResponseEntity.ok(ruleService.toDocument(ruleService.getRule(id)));
  }

  @PostMapping
  public ResponseEntity<RuleDocument> create(@RequestBody RuleDocument document) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ruleService.toDocument(ruleService.createRule(document)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<RuleDocument> update(
      @PathVariable("id") String id, @RequestBody RuleDocument changes) {
    return ResponseEntity.ok(ruleService.toDocument(ruleService.updateRule(id, changes)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    ruleService.deleteRule(id);
    return ResponseEntity.noContent().build();
  }
}
