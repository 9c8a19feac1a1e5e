package com.tradeflow.backend.trading.pipeline;

import com.tradeflow.backend.config.PipelineProperties;
import com.tradeflow.backend.model.Side;
import com.tradeflow.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Merges one cycle's proposals into at most one candidate decision per instrument.
 * <p>
 * The winning side is the one with the larger sum of {@code confidence * trustWeight}.
 * Ties go to the side with more proposals, then to the side holding the most recent
 * proposal. A tie on all three emits nothing for that instrument.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeightedConfidenceAggregator implements DecisionAggregator {

    private static final double EPSILON = 1e-9;

    private static final Comparator<Proposal> BY_CONFIDENCE_DESC = Comparator
            .comparingDouble(Proposal::confidence).reversed()
            .thenComparing(Proposal::generatedAt, Comparator.reverseOrder());

    private final PipelineProperties pipelineProperties;

    @Override
    public List<CandidateDecision> aggregate(List<Proposal> proposals, long cycleId) {
        if (proposals == null || proposals.isEmpty()) {
            return List.of();
        }
        // sorted for deterministic output order
        Map<String, List<Proposal>> byInstrument = proposals.stream()
                .collect(Collectors.groupingBy(Proposal::instrument, TreeMap::new, Collectors.toList()));

        List<CandidateDecision> decisions = new ArrayList<>();
        byInstrument.forEach((instrument, group) ->
                decide(instrument, group, cycleId).ifPresent(decisions::add));
        return decisions;
    }

    private Optional<CandidateDecision> decide(String instrument, List<Proposal> group, long cycleId) {
        List<Proposal> buys = group.stream().filter(p -> p.side() == Side.BUY).toList();
        List<Proposal> sells = group.stream().filter(p -> p.side() == Side.SELL).toList();

        Side winner = pickSide(buys, sells);
        if (winner == null) {
            log.info("Cycle {} {}: buy and sell proposals tie on weight, count and recency; no decision",
                    cycleId, instrument);
            return Optional.empty();
        }
        List<Proposal> winning = winner == Side.BUY ? buys : sells;

        BigDecimal quantity = clamp(instrument, weightedQuantity(winning));
        if (quantity.signum() <= 0) {
            log.info("Cycle {} {}: aggregated quantity rounds to zero; no decision", cycleId, instrument);
            return Optional.empty();
        }

        double confidence = winning.stream().mapToDouble(Proposal::confidence).max().orElse(0.0);
        Proposal latest = winning.stream().max(Comparator.comparing(Proposal::generatedAt)).orElseThrow();
        List<Proposal> contributing = group.stream().sorted(BY_CONFIDENCE_DESC).toList();
        String rationale = winning.stream()
                .sorted(BY_CONFIDENCE_DESC)
                .map(p -> p.agentId() + ": " + p.rationale())
                .collect(Collectors.joining("; "));

        return Optional.of(new CandidateDecision(
                cycleId,
                instrument,
                winner,
                quantity,
                confidence,
                latest.referencePrice(),
                contributing,
                rationale
        ));
    }

    private Side pickSide(List<Proposal> buys, List<Proposal> sells) {
        if (sells.isEmpty()) {
            return Side.BUY;
        }
        if (buys.isEmpty()) {
            return Side.SELL;
        }
        double buyWeight = weightedConfidence(buys);
        double sellWeight = weightedConfidence(sells);
        if (Math.abs(buyWeight - sellWeight) > EPSILON) {
            return buyWeight > sellWeight ? Side.BUY : Side.SELL;
        }
        if (buys.size() != sells.size()) {
            return buys.size() > sells.size() ? Side.BUY : Side.SELL;
        }
        int recency = latest(buys).compareTo(latest(sells));
        if (recency != 0) {
            return recency > 0 ? Side.BUY : Side.SELL;
        }
        return null;
    }

    double weightedConfidence(List<Proposal> proposals) {
        return proposals.stream()
                .mapToDouble(p -> p.confidence() * trustWeight(p.agentId()))
                .sum();
    }

    private double trustWeight(String agentId) {
        return pipelineProperties.getTrustWeights().getOrDefault(agentId, 1.0);
    }

    private static Instant latest(List<Proposal> proposals) {
        return proposals.stream().map(Proposal::generatedAt).max(Comparator.naturalOrder()).orElse(Instant.MIN);
    }

    private static BigDecimal weightedQuantity(List<Proposal> winning) {
        double confidenceSum = winning.stream().mapToDouble(Proposal::confidence).sum();
        if (confidenceSum <= 0.0) {
            BigDecimal sum = winning.stream().map(Proposal::suggestedQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            return sum.divide(BigDecimal.valueOf(winning.size()), MoneyUtils.SCALE, RoundingMode.DOWN);
        }
        BigDecimal numerator = BigDecimal.ZERO;
        for (Proposal p : winning) {
            numerator = numerator.add(p.suggestedQuantity().multiply(BigDecimal.valueOf(p.confidence())));
        }
        return numerator.divide(BigDecimal.valueOf(confidenceSum), MoneyUtils.SCALE, RoundingMode.DOWN);
    }

    private BigDecimal clamp(String instrument, BigDecimal quantity) {
        double max = pipelineProperties.getMaxQuantity()
                .getOrDefault(instrument, pipelineProperties.getDefaultMaxQuantity());
        BigDecimal cap = MoneyUtils.floorQuantity(BigDecimal.valueOf(max));
        return MoneyUtils.floorQuantity(quantity.min(cap));
    }
}
