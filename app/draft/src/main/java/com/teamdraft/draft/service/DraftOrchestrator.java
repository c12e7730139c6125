/*
 * どこで: Draft サービス層
 * 何を: 利用者アクションを stage で振り分け、フェーズ遷移とイベント追記までを1トランザクションで行う
 * なぜ: draft 行ロックで同一 draft の操作を直列化し、途中失敗時は何も残さないため
 */
package com.teamdraft.draft.service;

import com.teamdraft.common.TraceIds;
import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.api.response.DraftActionResponse;
import com.teamdraft.draft.model.DraftAction;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStage;
import com.teamdraft.draft.model.DraftStatus;
import com.teamdraft.draft.model.ParticipantRecord;
import com.teamdraft.draft.model.PickRecord;
import com.teamdraft.draft.repository.DraftRepository;
import com.teamdraft.draft.repository.ParticipantRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DraftOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(DraftOrchestrator.class);

  private final DraftRepository draftRepository;
  private final ParticipantRepository participantRepository;
  private final ClaimResolver claimResolver;
  private final PickResolver pickResolver;
  private final TurnTracker turnTracker;
  private final TurnStateLoader turnStateLoader;
  private final DraftEventRecorder eventRecorder;
  private final DraftMetrics metrics;
  private final Clock clock;

  @Transactional
  public DraftActionResponse submitAction(
      long draftId, long userId, DraftAction action, String traceId) {
    try {
      final DraftActionResponse response =
          execute(draftId, userId, action, TraceIds.resolve(traceId), Instant.now(clock));
      metrics.recordAction(action.kind().name(), DraftMetrics.RESULT_SUCCESS);
      return response;
    } catch (DraftActionException ex) {
      metrics.recordAction(action.kind().name(), ex.getCode().name().toLowerCase(Locale.ROOT));
      throw ex;
    }
  }

  private DraftActionResponse execute(
      long draftId, long userId, DraftAction action, String traceId, Instant now) {
    final DraftRecord draft =
        draftRepository.lockById(draftId).orElseThrow(() -> draftNotFound(draftId));
    ensureAcceptsActions(draft);
    final DraftStage requiredStage = action.kind().requiredStage();
    if (draft.stage() != requiredStage) {
      throw new DraftActionException(
          DraftErrorCode.INVALID_STAGE,
          String.format(
              "draft %d is in %s stage; this action needs %s",
              draftId, draft.stage(), requiredStage),
          Map.of("current_stage", draft.stage().name(), "required_stage", requiredStage.name()));
    }
    return switch (action.kind()) {
      case CHOOSE_CONFERENCE ->
          chooseConference(draft, userId, (DraftAction.ChooseConference) action, traceId, now);
      case CLAIM_TEAM -> claimTeam(draft, userId, (DraftAction.ClaimTeam) action, traceId, now);
      case MAKE_PICK -> makePick(draft, userId, (DraftAction.MakePick) action, traceId, now);
    };
  }

  private DraftActionResponse chooseConference(
      DraftRecord draft,
      long userId,
      DraftAction.ChooseConference action,
      String traceId,
      Instant now) {
    final String conference = claimResolver.chooseConference(draft, userId, action.conference());
    eventRecorder.conferenceChosen(draft, userId, conference, traceId, now);
    logger.info(
        "conference chosen draftId={} userId={} conference={}", draft.id(), userId, conference);
    final List<ParticipantRecord> participants = participantRepository.findByDraft(draft.id());
    DraftRecord updated = draft;
    if (participants.stream().allMatch(ParticipantRecord::conferenceChosen)) {
      updated = transition(draft, DraftStatus.PENDING, DraftStage.CLAIM, 0, null, traceId, now);
    }
    return response(draft, updated, action.kind(), userId, conference, null, null, null);
  }

  private DraftActionResponse claimTeam(
      DraftRecord draft, long userId, DraftAction.ClaimTeam action, String traceId, Instant now) {
    final String teamName = claimResolver.claimTeam(draft, userId, action.teamName(), now);
    final List<ParticipantRecord> participants = participantRepository.findByDraft(draft.id());
    final String conference =
        participants.stream()
            .filter(p -> p.userId() == userId)
            .map(ParticipantRecord::conference)
            .findFirst()
            .orElseThrow();
    eventRecorder.teamClaimed(draft, userId, conference, teamName, traceId, now);
    logger.info("team claimed draftId={} userId={} team={}", draft.id(), userId, teamName);
    if (!participants.stream().allMatch(ParticipantRecord::claimed)) {
      return response(draft, draft, action.kind(), userId, conference, teamName, null, null);
    }
    // 全員の claim が揃ったら drafting を開始し、最初に pick できる手番を求める
    final TurnState state = turnStateLoader.load(draft.id());
    final OptionalInt first = turnTracker.firstEligible(state, 0);
    final DraftRecord updated;
    Long nextUserId = null;
    if (first.isPresent()) {
      nextUserId = turnTracker.whoseTurn(state, first.getAsInt()).userId();
      updated =
          transition(
              draft,
              DraftStatus.ACTIVE,
              DraftStage.DRAFTING,
              first.getAsInt(),
              nextUserId,
              traceId,
              now);
    } else {
      updated = complete(draft, traceId, now);
    }
    return response(draft, updated, action.kind(), userId, conference, teamName, null, nextUserId);
  }

  private DraftActionResponse makePick(
      DraftRecord draft, long userId, DraftAction.MakePick action, String traceId, Instant now) {
    final TurnState before = turnStateLoader.load(draft.id());
    // 他の draft に残りチームを取られて手番の参加者が pick できなくなっている場合がある
    final OptionalInt effective = turnTracker.firstEligible(before, draft.currentPickIndex());
    if (effective.isEmpty()) {
      logger.info(
          "no participant can pick anymore; completing draftId={} requestedBy={}",
          draft.id(),
          userId);
      final DraftRecord completed = complete(draft, traceId, now);
      final String conference =
          before.participant(userId).map(ParticipantRecord::conference).orElse(null);
      return response(draft, completed, action.kind(), userId, conference, null, null, null);
    }
    final DraftRecord current = skipTo(draft, effective.getAsInt(), now);
    final PickRecord pick =
        pickResolver.makePick(current, before, userId, action.teamName(), now);
    // pick 数と残りチームが変わったので読み直してから次の手番を決める
    final TurnState after = turnStateLoader.load(draft.id());
    final OptionalInt next = turnTracker.advance(after, current.currentPickIndex());
    final String conference =
        after.participant(userId).map(ParticipantRecord::conference).orElse(null);
    if (next.isPresent()) {
      final long nextUserId = turnTracker.whoseTurn(after, next.getAsInt()).userId();
      draftRepository.updateProgress(
          draft.id(), DraftStatus.ACTIVE, DraftStage.DRAFTING, next.getAsInt(), now);
      final DraftRecord updated =
          draft.withProgress(DraftStatus.ACTIVE, DraftStage.DRAFTING, next.getAsInt(), now);
      eventRecorder.pickMade(
          updated, userId, pick.teamName(), pick.pickNumber(), nextUserId, traceId, now);
      logger.info(
          "pick made draftId={} pickNumber={} userId={} team={} nextUserId={}",
          draft.id(),
          pick.pickNumber(),
          userId,
          pick.teamName(),
          nextUserId);
      return response(
          draft, updated, action.kind(), userId, conference, pick.teamName(), pick.pickNumber(),
          nextUserId);
    }
    eventRecorder.pickMade(draft, userId, pick.teamName(), pick.pickNumber(), null, traceId, now);
    logger.info(
        "pick made draftId={} pickNumber={} userId={} team={} nextUserId=none",
        draft.id(),
        pick.pickNumber(),
        userId,
        pick.teamName());
    final DraftRecord updated = complete(current, traceId, now);
    return response(
        draft, updated, action.kind(), userId, conference, pick.teamName(), pick.pickNumber(),
        null);
  }

  /** 手番が進まない場合は draft をそのまま返す。 */
  private DraftRecord skipTo(DraftRecord draft, int pickIndex, Instant now) {
    if (pickIndex == draft.currentPickIndex()) {
      return draft;
    }
    draftRepository.updateProgress(
        draft.id(), DraftStatus.ACTIVE, DraftStage.DRAFTING, pickIndex, now);
    logger.info(
        "turn skipped draftId={} fromIndex={} toIndex={}",
        draft.id(),
        draft.currentPickIndex(),
        pickIndex);
    return draft.withProgress(DraftStatus.ACTIVE, DraftStage.DRAFTING, pickIndex, now);
  }

  private DraftRecord transition(
      DraftRecord draft,
      DraftStatus status,
      DraftStage stage,
      int pickIndex,
      Long nextUserId,
      String traceId,
      Instant now) {
    draftRepository.updateProgress(draft.id(), status, stage, pickIndex, now);
    final DraftRecord updated = draft.withProgress(status, stage, pickIndex, now);
    eventRecorder.stageChanged(updated, nextUserId, traceId, now);
    metrics.recordStageTransition(draft.stage().name(), stage.name());
    logger.info(
        "draft stage changed draftId={} from={} to={} status={}",
        draft.id(),
        draft.stage(),
        stage,
        status);
    return updated;
  }

  private DraftRecord complete(DraftRecord draft, String traceId, Instant now) {
    final DraftRecord completed =
        transition(
            draft,
            DraftStatus.COMPLETED,
            DraftStage.DONE,
            draft.currentPickIndex(),
            null,
            traceId,
            now);
    eventRecorder.completed(completed, traceId, now);
    return completed;
  }

  static void ensureAcceptsActions(DraftRecord draft) {
    if (draft.status() == DraftStatus.CANCELLED) {
      throw new DraftActionException(
          DraftErrorCode.DRAFT_CANCELLED, "draft " + draft.id() + " has been cancelled");
    }
    if (draft.status() == DraftStatus.COMPLETED || draft.stage() == DraftStage.DONE) {
      throw new DraftActionException(
          DraftErrorCode.DRAFT_COMPLETED, "draft " + draft.id() + " is already completed");
    }
  }

  static DraftActionException draftNotFound(long draftId) {
    return new DraftActionException(
        DraftErrorCode.DRAFT_NOT_FOUND, "draft " + draftId + " was not found");
  }

  private DraftActionResponse response(
      DraftRecord before,
      DraftRecord after,
      DraftAction.Kind kind,
      long userId,
      String conference,
      String teamName,
      Integer pickNumber,
      Long nextUserId) {
    return new DraftActionResponse(
        after.id(),
        kind.name(),
        userId,
        after.stage().name(),
        after.status().name(),
        conference,
        teamName,
        pickNumber,
        nextUserId,
        before.stage() != after.stage());
  }
}
