package com.phillippitts.windowanalysis.service.synthesis;

import com.phillippitts.windowanalysis.domain.Dimensions;
import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.FieldValue;
import com.phillippitts.windowanalysis.domain.FrameMaterial;
import com.phillippitts.windowanalysis.domain.NormalizedResult;
import com.phillippitts.windowanalysis.domain.Recommendation;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.domain.WindowCategory;
import com.phillippitts.windowanalysis.domain.WindowCondition;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Priority-ordered consensus merge.
 *
 * <p>Rules:
 * <ul>
 *   <li>Categorical fields: the first contributing provider (by {@link ProviderPriority}) with a
 *       known value supplies it and becomes its provenance</li>
 *   <li>Dimensions: the contributing result with the highest confidence; ties go to priority</li>
 *   <li>Window count: the first contributing provider that stated one; otherwise
 *       {@value NormalizedResult#DEFAULT_WINDOW_COUNT} without provenance</li>
 *   <li>Recommendations: union in priority order, duplicates (case-insensitive) dropped, each keeping
 *       the provider that first reported it. When nobody reported one, a single default measurement
 *       recommendation without provenance is added</li>
 *   <li>Aggregate confidence: mean of the contributing providers' confidences; non-contributors
 *       are excluded, not counted as zero</li>
 *   <li>Quality score: weighted completeness of the merged fields, see {@link #qualityScore}</li>
 * </ul>
 */
public class PriorityConsensusSynthesizer implements Synthesizer {

    private static final Logger LOG = LogManager.getLogger(PriorityConsensusSynthesizer.class);

    static final Recommendation DEFAULT_RECOMMENDATION = new Recommendation(
            "Schedule professional measurement consultation for accurate assessment",
            Recommendation.Category.MEASUREMENT,
            Recommendation.Priority.HIGH);

    private final ProviderPriority priority;
    private final Clock clock;

    public PriorityConsensusSynthesizer(ProviderPriority priority, Clock clock) {
        this.priority = Objects.requireNonNull(priority, "priority");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SynthesizedResult synthesize(String requestId,
                                        List<String> requestedProviders,
                                        Collection<NormalizedResult> results,
                                        Map<String, FailureReason> failures) {
        Objects.requireNonNull(requestId, "requestId");

        List<NormalizedResult> ordered = orderAndDeduplicate(results);
        List<NormalizedResult> contributors = new ArrayList<>();
        Map<String, FailureReason> failed = new TreeMap<>(priority);
        failed.putAll(failures == null ? Map.of() : failures);

        for (NormalizedResult r : ordered) {
            if (r.contributes()) {
                contributors.add(r);
                failed.remove(r.providerId());
            } else {
                failed.putIfAbsent(r.providerId(), FailureReason.NO_CONTRIBUTION);
            }
        }
        Set<String> contributorIds = new HashSet<>();
        contributors.forEach(r -> contributorIds.add(r.providerId()));
        for (String requested : requestedProviders) {
            if (!contributorIds.contains(requested)) {
                failed.putIfAbsent(requested, FailureReason.NO_CONTRIBUTION);
            }
        }

        if (contributors.isEmpty()) {
            LOG.warn("No provider contributed to request {}: {}", requestId, failed);
            throw new AllProvidersFailedException(requestId, new LinkedHashMap<>(failed));
        }

        FieldValue<WindowCategory> category = firstKnown(contributors, NormalizedResult::category,
                NormalizedResult::hasCategory, WindowCategory.UNKNOWN);
        FieldValue<FrameMaterial> material = firstKnown(contributors, NormalizedResult::material,
                NormalizedResult::hasMaterial, FrameMaterial.UNKNOWN);
        FieldValue<WindowCondition> condition = firstKnown(contributors, NormalizedResult::condition,
                NormalizedResult::hasCondition, WindowCondition.UNKNOWN);
        FieldValue<Dimensions> dimensions = mostConfidentDimensions(contributors);
        FieldValue<Integer> windowCount = firstKnown(contributors, NormalizedResult::windowCount,
                NormalizedResult::hasWindowCount, NormalizedResult.DEFAULT_WINDOW_COUNT);
        List<FieldValue<Recommendation>> recommendations = mergeRecommendations(contributors);
        int aggregate = meanConfidence(contributors);
        int quality = qualityScore(windowCount.value(), category.value(), material.value(), condition.value(),
                dimensions.value(), aggregate);

        List<String> contributing = contributors.stream().map(NormalizedResult::providerId).toList();
        boolean partial = contributing.size() < requestedProviders.size();

        SynthesizedResult result = new SynthesizedResult(requestId, category, material, condition, dimensions,
                windowCount, recommendations, aggregate, quality, requestedProviders, contributing, failed, partial,
                clock.instant());

        LOG.info("Synthesized request={} category={}({}) material={}({}) condition={}({}) windows={}({}) "
                        + "confidence={} quality={} contributors={} failed={} partial={}",
                requestId, category.value(), category.provider(), material.value(), material.provider(),
                condition.value(), condition.provider(), windowCount.value(), windowCount.provider(), aggregate,
                quality, contributing, failed.keySet(), partial);
        return result;
    }

    private List<NormalizedResult> orderAndDeduplicate(Collection<NormalizedResult> results) {
        List<NormalizedResult> sorted = new ArrayList<>(results == null ? List.of() : results);
        sorted.sort(Comparator.comparing(NormalizedResult::providerId, priority));
        List<NormalizedResult> unique = new ArrayList<>(sorted.size());
        Set<String> seen = new HashSet<>();
        for (NormalizedResult r : sorted) {
            if (seen.add(r.providerId())) {
                unique.add(r);
            } else {
                LOG.warn("Ignoring duplicate result for provider {}", r.providerId());
            }
        }
        return unique;
    }

    private static <T> FieldValue<T> firstKnown(List<NormalizedResult> contributors,
                                                Function<NormalizedResult, T> field,
                                                Predicate<NormalizedResult> present,
                                                T unknown) {
        for (NormalizedResult r : contributors) {
            if (present.test(r)) {
                return FieldValue.of(field.apply(r), r.providerId());
            }
        }
        return FieldValue.unattributed(unknown);
    }

    private static FieldValue<Dimensions> mostConfidentDimensions(List<NormalizedResult> contributors) {
        NormalizedResult best = null;
        for (NormalizedResult r : contributors) {
            // contributors are priority-ordered, so strict > keeps the higher-priority one on ties
            if (r.hasDimensions() && (best == null || r.confidence() > best.confidence())) {
                best = r;
            }
        }
        return best == null ? FieldValue.unattributed(null) : FieldValue.of(best.dimensions(), best.providerId());
    }

    private static List<FieldValue<Recommendation>> mergeRecommendations(List<NormalizedResult> contributors) {
        Map<String, FieldValue<Recommendation>> merged = new LinkedHashMap<>();
        for (NormalizedResult r : contributors) {
            for (Recommendation rec : r.recommendations()) {
                String key = rec.text().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
                merged.putIfAbsent(key, FieldValue.of(rec, r.providerId()));
            }
        }
        if (merged.isEmpty()) {
            return List.of(FieldValue.unattributed(DEFAULT_RECOMMENDATION));
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Weighted completeness: windows 20, category 20, material 20, condition 10, dimensions 20,
     * and 10 more when the aggregate confidence is above 70.
     */
    static int qualityScore(int windowCount, WindowCategory category, FrameMaterial material,
                            WindowCondition condition, Dimensions dimensions, int aggregateConfidence) {
        int score = 0;
        if (windowCount > 0) {
            score += 20;
        }
        if (category.isKnown()) {
            score += 20;
        }
        if (material.isKnown()) {
            score += 20;
        }
        if (condition.isKnown()) {
            score += 10;
        }
        if (dimensions != null) {
            score += 20;
        }
        if (aggregateConfidence > 70) {
            score += 10;
        }
        return score;
    }

    private static int meanConfidence(List<NormalizedResult> contributors) {
        double sum = 0;
        for (NormalizedResult r : contributors) {
            sum += r.confidence();
        }
        return (int) Math.round(sum / contributors.size());
    }
}
