package com.stresscast.scenario.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stresscast.scenario.model.Domain;
import com.stresscast.scenario.model.EconomicAnalysis;
import com.stresscast.scenario.model.ScenarioExplanation;
import com.stresscast.scenario.model.SimulationRun;
import com.stresscast.scenario.model.SimulationSummary;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Executive-level explanation of a stored run. Uses the text generation service when it is
 * configured and answers with a rule-based explanation otherwise.
 */
@Service
public class ScenarioExplainer {

    private static final Logger log = LoggerFactory.getLogger(ScenarioExplainer.class);

    static final String PROVIDER_AI = "openai";
    static final String PROVIDER_RULES = "rules";
    static final double AI_CONFIDENCE = 0.85;
    static final double RULES_CONFIDENCE = 0.6;
    private static final int MAX_INSIGHTS = 4;
    private static final int MAX_RISKS = 3;
    private static final int MAX_RECOMMENDATIONS = 4;
    private static final int PROMPT_REGIONS = 3;
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private static final String SYSTEM_PROMPT = """
            You are a policy advisor for El Salvador's government. Explain simulation results in clear,
            actionable language for cabinet ministers. Use specific numbers from the data, name the three
            most affected regions and give recommendations with 30/90/180 day timelines.
            Reply with JSON only, shaped as:
            {"summary": string, "key_insights": [string], "risks": [string],
             "recommendations": [{"priority": "critical|high|medium|low", "title": string,
             "description": string, "timeline": string, "estimated_cost_usd": number}]}
            """;

    private final TextGenerationClient textClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ScenarioExplainer(TextGenerationClient textClient, ObjectMapper objectMapper) {
        this(textClient, objectMapper, Clock.systemUTC());
    }

    ScenarioExplainer(TextGenerationClient textClient, ObjectMapper objectMapper, Clock clock) {
        this.textClient = textClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ScenarioExplanation explain(SimulationRun run) {
        ScenarioExplanation rules = ruleBased(run);
        if (!textClient.hasCredentials()) {
            return rules;
        }
        List<TextGenerationClient.Message> messages = List.of(
                new TextGenerationClient.Message("system", SYSTEM_PROMPT),
                new TextGenerationClient.Message("user", buildPrompt(run)));
        Optional<String> reply = textClient.generateText(messages, 1000);
        if (reply.isEmpty()) {
            log.warn("Scenario explanation: no reply for run {}, using rules", run.runId());
            return rules;
        }
        return parseReply(reply.get(), rules).orElseGet(() -> {
            log.warn("Scenario explanation: unparsable reply for run {}, using rules", run.runId());
            return rules;
        });
    }

    String buildPrompt(SimulationRun run) {
        SimulationSummary summary = run.summary();
        EconomicAnalysis economics = run.economicAnalysis();
        String scenario;
        try {
            scenario = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(run.scenario());
        } catch (JsonProcessingException ex) {
            scenario = String.valueOf(run.scenario());
        }
        String topRegions = summary.topStressedRegions().stream()
                .limit(PROMPT_REGIONS)
                .map(SimulationSummary.TopStressedRegion::regionName)
                .collect(Collectors.joining(", "));
        return """
                Analyze this %s simulation for El Salvador:

                SCENARIO TESTED:
                %s

                RESULTS:
                - Average stress: %s
                - Most affected regions: %s
                - Economic exposure: %s
                - Recommended investment: %s
                - ROI (5-year): %s
                - Annual savings: %s
                """.formatted(
                run.domain().code(),
                scenario,
                percent(summary.avgStress()),
                topRegions.isEmpty() ? "N/A" : topRegions,
                millions(economics != null ? economics.totalEconomicExposureUsd() : null, ""),
                millions(economics != null ? economics.infrastructureInvestmentUsd() : null, ""),
                economics != null && economics.roi5Year() != null && economics.roi5Year().signum() != 0
                        ? percent(economics.roi5Year().doubleValue())
                        : "N/A",
                millions(economics != null ? economics.annualCostsPreventedUsd() : null, "/year"));
    }

    Optional<ScenarioExplanation> parseReply(String reply, ScenarioExplanation rules) {
        JsonNode root = readJson(reply);
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        String summary = root.path("summary").asText("").trim();
        if (summary.isEmpty()) {
            return Optional.empty();
        }
        List<String> insights = strings(root.path("key_insights"), MAX_INSIGHTS);
        List<String> risks = strings(root.path("risks"), MAX_RISKS);
        List<ScenarioExplanation.ActionItem> actions = new ArrayList<>();
        for (JsonNode item : root.path("recommendations")) {
            String title = item.path("title").asText("").trim();
            if (title.isEmpty()) {
                continue;
            }
            BigDecimal cost = item.path("estimated_cost_usd").isNumber()
                    ? item.path("estimated_cost_usd").decimalValue().setScale(0, RoundingMode.HALF_UP)
                    : null;
            actions.add(new ScenarioExplanation.ActionItem(
                    priority(item.path("priority").asText("")),
                    title,
                    item.path("description").asText(""),
                    item.path("timeline").asText("90 days"),
                    cost));
            if (actions.size() == MAX_RECOMMENDATIONS) {
                break;
            }
        }
        return Optional.of(new ScenarioExplanation(
                summary,
                insights.isEmpty() ? rules.keyInsights() : insights,
                risks.isEmpty() ? rules.risks() : risks,
                actions.isEmpty() ? rules.recommendations() : List.copyOf(actions),
                AI_CONFIDENCE,
                clock.instant(),
                PROVIDER_AI));
    }

    ScenarioExplanation ruleBased(SimulationRun run) {
        Domain domain = run.domain();
        SimulationSummary summary = run.summary();
        EconomicAnalysis economics = run.economicAnalysis();
        List<SimulationSummary.TopStressedRegion> top = summary.topStressedRegions();
        String topNames = top.stream()
                .limit(PROMPT_REGIONS)
                .map(SimulationSummary.TopStressedRegion::regionName)
                .collect(Collectors.joining(", "));

        String text;
        if (run.dailyResults().isEmpty()) {
            text = "No historical %s data was available for the selected period, so no stress could be projected."
                    .formatted(domain.code());
        } else {
            text = "The %s scenario projects an average stress of %s with a peak of %s. %s"
                    .formatted(domain.code(), percent(summary.avgStress()), percent(summary.maxStress()),
                            topNames.isEmpty() ? "" : "The most affected regions are " + topNames + ".")
                    .trim();
        }

        List<String> insights = new ArrayList<>();
        insights.add("Average stress: " + percent(summary.avgStress()) + ", peak: " + percent(summary.maxStress()));
        insights.add(summary.criticalDays() + " region-days exceed the critical level of "
                + percent(domain.criticalThreshold()));
        if (!top.isEmpty()) {
            insights.add("Highest regional stress: " + top.get(0).regionName() + " at " + percent(top.get(0).avgStress()));
        }
        if (summary.yieldImpact() != null && summary.yieldImpact().mostAffectedCrop() != null) {
            insights.add("Most affected crop: " + summary.yieldImpact().mostAffectedCrop()
                    + " with " + percent(summary.yieldImpact().totalYieldLossPct() / 100) + " yield loss");
        }

        List<String> risks = new ArrayList<>();
        if (summary.criticalDays() > 0) {
            risks.add("Critical stress on " + summary.criticalDays() + " region-days");
        }
        if (summary.totalUnmetDemand() != null && summary.totalUnmetDemand() > 0) {
            risks.add("Unmet demand of " + decimal(summary.totalUnmetDemand()) + " over the period");
        }
        if (economics != null && economics.costOfInaction5YearUsd() != null && economics.costOfInaction5YearUsd().signum() > 0) {
            risks.add("Cost of inaction over five years: " + millions(economics.costOfInaction5YearUsd(), ""));
        }
        if (risks.isEmpty()) {
            risks.add("No critical stress projected for this scenario");
        }

        List<ScenarioExplanation.ActionItem> actions = new ArrayList<>();
        BigDecimal investment = economics != null ? economics.infrastructureInvestmentUsd() : null;
        if (summary.maxStress() > domain.criticalThreshold()) {
            actions.add(new ScenarioExplanation.ActionItem(
                    ScenarioExplanation.Priority.CRITICAL,
                    "Prepare contingency plans for " + (topNames.isEmpty() ? "stressed regions" : topNames),
                    "Coordinate emergency supply and demand management in regions above the critical level",
                    "30 days",
                    null));
        }
        if (investment != null && investment.signum() > 0) {
            actions.add(new ScenarioExplanation.ActionItem(
                    ScenarioExplanation.Priority.HIGH,
                    "Fund infrastructure investment",
                    "Payback in " + economics.paybackPeriodMonths() + " months with a five-year ROI of "
                            + percent(economics.roi5Year().doubleValue()),
                    "180 days",
                    investment));
        }
        actions.add(new ScenarioExplanation.ActionItem(
                ScenarioExplanation.Priority.MEDIUM,
                "Monitor regional stress indicators",
                "Re-run the scenario as new historical data arrives",
                "90 days",
                null));

        return new ScenarioExplanation(
                text,
                List.copyOf(insights.subList(0, Math.min(MAX_INSIGHTS, insights.size()))),
                List.copyOf(risks.subList(0, Math.min(MAX_RISKS, risks.size()))),
                List.copyOf(actions.subList(0, Math.min(MAX_RECOMMENDATIONS, actions.size()))),
                RULES_CONFIDENCE,
                clock.instant(),
                PROVIDER_RULES);
    }

    private JsonNode readJson(String reply) {
        String s = reply == null ? "" : reply.trim();
        if (s.startsWith("```")) {
            int firstNl = s.indexOf('\n');
            s = firstNl > 0 ? s.substring(firstNl + 1) : "";
            int fence = s.lastIndexOf("```");
            if (fence >= 0) {
                s = s.substring(0, fence);
            }
        }
        int firstBrace = s.indexOf('{');
        int lastBrace = s.lastIndexOf('}');
        if (firstBrace < 0 || lastBrace <= firstBrace) {
            return null;
        }
        try {
            return objectMapper.readTree(s.substring(firstBrace, lastBrace + 1));
        } catch (JsonProcessingException ex) {
            log.debug("Scenario explanation: reply is not JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private static List<String> strings(JsonNode node, int limit) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String text = item.asText("").trim();
            if (!text.isEmpty() && values.size() < limit) {
                values.add(text);
            }
        }
        return List.copyOf(values);
    }

    static ScenarioExplanation.Priority priority(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("critical")) {
            return ScenarioExplanation.Priority.CRITICAL;
        }
        if (normalized.contains("high")) {
            return ScenarioExplanation.Priority.HIGH;
        }
        if (normalized.contains("low")) {
            return ScenarioExplanation.Priority.LOW;
        }
        return ScenarioExplanation.Priority.MEDIUM;
    }

    static String percent(double ratio) {
        return BigDecimal.valueOf(Double.isFinite(ratio) ? ratio * 100 : 0)
                .setScale(1, RoundingMode.HALF_UP)
                .toPlainString() + "%";
    }

    static String millions(BigDecimal usd, String suffix) {
        if (usd == null || usd.signum() == 0) {
            return "N/A";
        }
        return "$" + usd.divide(MILLION, 1, RoundingMode.HALF_UP).toPlainString() + "M" + suffix;
    }

    private static String decimal(double value) {
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
