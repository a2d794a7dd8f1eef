package com.serpintel.volatility.service;

import com.serpintel.common.delta.SerpDelta;
import com.serpintel.common.delta.SerpDeltaCalculator;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.exception.ResourceNotFoundException;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.volatility.dto.SerpDeltaResponse;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;
import com.serpintel.volatility.repository.SerpSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

import static com.serpintel.volatility.service.SnapshotObservationMapper.toInstant;

/**
 * Rank and AI-overview differences between two snapshots of a keyword,
 * either an explicit pair or the latest two captures.
 */
@Service
public class SerpDeltaService {

    private static final Logger log = LoggerFactory.getLogger(SerpDeltaService.class);

    private final KeywordTargetService      keywordTargetService;
    private final SerpSnapshotRepository    repository;
    private final SnapshotObservationMapper mapper;

    public SerpDeltaService(KeywordTargetService keywordTargetService,
                            SerpSnapshotRepository repository,
                            SnapshotObservationMapper mapper) {
        this.keywordTargetService = keywordTargetService;
        this.repository           = repository;
        this.mapper               = mapper;
    }

    /**
     * @param fromSnapshotId explicit older snapshot; must be given together with {@code toSnapshotId}
     */
    public Mono<SerpDeltaResponse> delta(UUID projectId, UUID keywordTargetId,
                                         UUID fromSnapshotId, UUID toSnapshotId) {
        if ((fromSnapshotId == null) != (toSnapshotId == null)) {
            return Mono.error(new InvalidParameterException(ErrorCode.VALIDATION_ERROR,
                fromSnapshotId == null ? "fromSnapshotId" : "toSnapshotId",
                "fromSnapshotId and toSnapshotId must both be provided, or both omitted"));
        }
        return keywordTargetService.require(projectId, keywordTargetId).flatMap(target -> {
            if (fromSnapshotId != null) {
                return Mono.zip(
                        owned(projectId, target, fromSnapshotId, "fromSnapshotId"),
                        owned(projectId, target, toSnapshotId, "toSnapshotId"))
                    .map(pair -> compute(target, pair.getT1(), pair.getT2()));
            }
            return repository.findLatestTwo(projectId, target.getQuery(), target.getLocale(), target.getDevice())
                .collectList()
                .map(latest -> latest.size() < 2
                    ? insufficient(target, latest)
                    : compute(target, latest.get(1), latest.get(0)));
        });
    }

    private Mono<SerpSnapshot> owned(UUID projectId, KeywordTarget target, UUID snapshotId, String field) {
        return repository.findByIdAndProjectId(snapshotId, projectId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException(field)))
            .flatMap(s -> matches(target, s)
                ? Mono.just(s)
                : Mono.error(new InvalidParameterException(ErrorCode.VALIDATION_ERROR, field,
                    field + " does not match the keywordTarget's query/locale/device")));
    }

    private static boolean matches(KeywordTarget t, SerpSnapshot s) {
        return t.getQuery().equals(s.getQuery())
            && t.getLocale().equals(s.getLocale())
            && t.getDevice().equals(s.getDevice());
    }

    private SerpDeltaResponse compute(KeywordTarget target, SerpSnapshot from, SerpSnapshot to) {
        SnapshotObservation a = mapper.toObservation(from);
        SnapshotObservation b = mapper.toObservation(to);
        SerpDelta delta = SerpDeltaCalculator.compute(a, b);
        boolean sameTimestamp = from.getCapturedAt().equals(to.getCapturedAt());
        boolean parseWarning  = a.parseWarning() || b.parseWarning();
        if (parseWarning) {
            log.warn("SERP delta computed over unrecognised payload. keywordTargetId={} from={} to={}",
                     target.getId(), from.getId(), to.getId());
        }
        log.debug("SERP delta computed. keywordTargetId={} moved={} entered={} exited={}",
                  target.getId(), delta.summary().movedCount(), delta.summary().enteredCount(),
                  delta.summary().exitedCount());
        return new SerpDeltaResponse(delta, new SerpDeltaResponse.Metadata(
            target.getId(), target.getQuery(), target.getLocale(), target.getDevice(),
            false, 2, sameTimestamp, parseWarning, ref(from), ref(to)));
    }

    private static SerpDeltaResponse insufficient(KeywordTarget target, List<SerpSnapshot> latest) {
        return new SerpDeltaResponse(null, new SerpDeltaResponse.Metadata(
            target.getId(), target.getQuery(), target.getLocale(), target.getDevice(),
            true, latest.size(), null, null,
            latest.isEmpty() ? null : ref(latest.get(0)), null));
    }

    private static SerpDeltaResponse.SnapshotRef ref(SerpSnapshot s) {
        return new SerpDeltaResponse.SnapshotRef(s.getId(), toInstant(s.getCapturedAt()),
            s.getAiOverviewStatus(), s.getSource());
    }
}
