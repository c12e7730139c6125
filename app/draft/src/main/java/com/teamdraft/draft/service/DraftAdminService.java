/*
 * どこで: Draft サービス層
 * 何を: draft の作成(参加者と pick 上限の登録)と取消を行う
 * なぜ: 管理操作も利用者アクションと同じ行ロックとイベント追記の規則に従わせるため
 */
package com.teamdraft.draft.service;

import com.teamdraft.common.TraceIds;
import com.teamdraft.draft.api.DraftActionException;
import com.teamdraft.draft.api.DraftErrorCode;
import com.teamdraft.draft.api.request.CreateDraftRequest;
import com.teamdraft.draft.config.DraftRulesProperties;
import com.teamdraft.draft.model.DraftRecord;
import com.teamdraft.draft.model.DraftStatus;
import com.teamdraft.draft.repository.AssignedTeamRepository;
import com.teamdraft.draft.repository.DraftRepository;
import com.teamdraft.draft.repository.ParticipantLimitRepository;
import com.teamdraft.draft.repository.ParticipantRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DraftAdminService {

  private static final Logger logger = LoggerFactory.getLogger(DraftAdminService.class);

  private final DraftRepository draftRepository;
  private final ParticipantRepository participantRepository;
  private final ParticipantLimitRepository limitRepository;
  private final AssignedTeamRepository assignedTeamRepository;
  private final DraftEventRecorder eventRecorder;
  private final TeamCatalog teamCatalog;
  private final DraftRulesProperties rules;
  private final Clock clock;

  @Transactional
  public DraftRecord createDraft(CreateDraftRequest request, long actorUserId, String traceId) {
    final List<Long> userIds = request.participantUserIds();
    final Set<Long> unique = new HashSet<>(userIds);
    if (unique.size() != userIds.size()) {
      throw new IllegalArgumentException("participant_user_ids must not contain duplicates");
    }
    // 座席数を超えると誰かがどの conference も選べず、CLAIM に進めなくなる
    final int seats = teamCatalog.conferences().size() * rules.maxConferenceParticipants();
    if (userIds.size() > seats) {
      throw new IllegalArgumentException(
          String.format(
              "participant_user_ids has %d users but only %d conference seats exist"
                  + " (%d conferences x %d)",
              userIds.size(),
              seats,
              teamCatalog.conferences().size(),
              rules.maxConferenceParticipants()));
    }
    for (Long overridden : request.picksAllowedOverrides().keySet()) {
      if (!unique.contains(overridden)) {
        throw new IllegalArgumentException(
            "picks_allowed_overrides contains a non-participant: " + overridden);
      }
    }
    final Instant now = Instant.now(clock);
    final DraftRecord draft;
    try {
      draft = draftRepository.insert(request.guildId(), request.channelId(), now);
    } catch (DuplicateKeyException ex) {
      throw new DraftActionException(
          DraftErrorCode.DRAFT_ALREADY_OPEN,
          "guild " + request.guildId() + " already has an open draft",
          Map.of("guild_id", request.guildId()));
    }
    participantRepository.insertAll(draft.id(), userIds);
    limitRepository.insertAll(draft.id(), resolveLimits(request));
    eventRecorder.draftCreated(draft, actorUserId, TraceIds.resolve(traceId));
    logger.info(
        "draft created draftId={} guildId={} participants={}",
        draft.id(),
        draft.guildId(),
        userIds.size());
    return draft;
  }

  /** 上限なしの参加者は結果に含めない。 */
  Map<Long, Integer> resolveLimits(CreateDraftRequest request) {
    final Integer common =
        request.unlimitedPicks()
            ? null
            : request.picksAllowed() != null ? request.picksAllowed() : rules.defaultPicksAllowed();
    final Map<Long, Integer> limits = new LinkedHashMap<>();
    for (Long userId : request.participantUserIds()) {
      final Integer limit = request.picksAllowedOverrides().getOrDefault(userId, common);
      if (limit != null) {
        limits.put(userId, limit);
      }
    }
    return limits;
  }

  @Transactional
  public DraftRecord cancelDraft(long draftId, long actorUserId, String traceId) {
    // 利用者アクションと同じ行ロックを取り、取消後に届いたアクションは CANCELLED を読む
    final DraftRecord draft =
        draftRepository
            .lockById(draftId)
            .orElseThrow(() -> DraftOrchestrator.draftNotFound(draftId));
    DraftOrchestrator.ensureAcceptsActions(draft);
    final Instant now = Instant.now(clock);
    if (draftRepository.markCancelled(draftId, now) == 0) {
      throw new IllegalStateException("draft status changed under lock draftId=" + draftId);
    }
    int released = 0;
    if (rules.releaseTeamsOnCancel()) {
      released = assignedTeamRepository.deleteByDraft(draftId);
    }
    final DraftRecord cancelled =
        draft.withProgress(DraftStatus.CANCELLED, draft.stage(), draft.currentPickIndex(), now);
    eventRecorder.cancelled(cancelled, actorUserId, TraceIds.resolve(traceId), now);
    logger.info(
        "draft cancelled draftId={} actorUserId={} stage={} releasedTeams={}",
        draftId,
        actorUserId,
        draft.stage(),
        released);
    return cancelled;
  }
}
