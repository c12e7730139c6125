/*
 * どこで: Draft API
 * 何を: 管理者向けの draft 作成/取消エンドポイントを提供する
 * なぜ: ADMIN ロールが必要な操作を /v1/admin 配下にまとめ、認可ルールを単純にするため
 */
package com.teamdraft.draft.api;

import com.teamdraft.draft.api.request.CreateDraftRequest;
import com.teamdraft.draft.api.response.DraftResponse;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.service.DraftAdminService;
import com.teamdraft.draft.service.DraftQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/drafts")
@RequiredArgsConstructor
public class DraftAdminController {

  private final DraftAdminService adminService;
  private final DraftQueryService queryService;

  @PostMapping
  public ResponseEntity<DraftResponse> create(
      @RequestHeader(DraftController.HEADER_USER_ID) long actorUserId,
      @RequestHeader(value = DraftController.HEADER_TRACE_ID, required = false) String traceId,
      @Valid @RequestBody CreateDraftRequest request) {
    final DraftRecord draft = adminService.createDraft(request, actorUserId, traceId);
    return ResponseEntity.status(HttpStatus.CREATED).body(queryService.getDraft(draft.id()));
  }

  @PostMapping("/{draft_id}/cancel")
  public DraftResponse cancel(
      @PathVariable("draft_id") long draftId,
      @RequestHeader(DraftController.HEADER_USER_ID) long actorUserId,
      @RequestHeader(value = DraftController.HEADER_TRACE_ID, required = false) String traceId) {
    adminService.cancelDraft(draftId, actorUserId, traceId);
    return queryService.getDraft(draftId);
  }
}
