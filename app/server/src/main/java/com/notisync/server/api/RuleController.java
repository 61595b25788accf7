package com.notisync.server.api;

import static com.notisync.server.api.NotificationController.requireUserId;
import static com.notisync.server.config.RequestMdcInterceptor.USER_ID_HEADER;

import com.notisync.common.rules.RuleDocument;
import com.notisync.server.service.UserRuleService;
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
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Per-user rules evaluated by the Rule Authority. */
@RestController
@RequestMapping("/v1/rules")
@RequiredArgsConstructor
public class RuleController {

  private final UserRuleService ruleService;

  @GetMapping
  public ResponseEntity<List<RuleDocument>> list(@RequestHeader(USER_ID_HEADER) String userId) {
    return ResponseEntity.ok(
        ruleService.rules(requireUserId(userId)).stream().map(ruleService::toDocument).toList());
  }

  @PostMapping
  public ResponseEntity<RuleDocument> create(
      @RequestHeader(USER_ID_HEADER) String userId, @RequestBody RuleDocument document) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ruleService.toDocument(ruleService.createRule(requireUserId(userId), document)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<RuleDocument> update(
      @RequestHeader(USER_ID_HEADER) String userId,
      @PathVariable("id") String id,
      @RequestBody RuleDocument changes) {
    return ResponseEntity.ok(
        ruleService.toDocument(ruleService.updateRule(requireUserId(userId), id, changes)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @RequestHeader(USER_ID_HEADER) String userId, @PathVariable("id") String id) {
    ruleService.deleteRule(requireUserId(userId), id);
    return ResponseEntity.noContent().build();
  }
}
