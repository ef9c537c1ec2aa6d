package com.stresscast.scenario.export;

import com.stresscast.scenario.model.SimulationResult;
import com.stresscast.scenario.model.SimulationSummary;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Flattens stored runs into spreadsheet-friendly CSV. Region names are always quoted;
 * the unmet demand column appears only for runs that track it. Rows are newline separated
 * with no trailing newline.
 */
public final class ResultCsvExporter {

    static final String DAILY_HEADER = "date,region_id,region_name,demand,supply,stress";
    static final String UNMET_COLUMN = ",unmet_demand";
    static final String TOP_REGIONS_HEADER = "rank,region_id,region_name,avg_stress";

    private ResultCsvExporter() {
    }

    public static String dailyResults(List<SimulationResult> results) {
        boolean withUnmet = results.stream().map(SimulationResult::unmetDemand).anyMatch(Objects::nonNull);
        StringBuilder sb = new StringBuilder(DAILY_HEADER);
        if (withUnmet) {
            sb.append(UNMET_COLUMN);
        }
        for (SimulationResult result : results) {
            sb.append('\n')
                    .append(result.date())
                    .append(',')
                    .append(nullToEmpty(result.regionId()))
                    .append(',')
                    .append(quote(result.regionName()))
                    .append(',')
                    .append(decimal(result.demand(), 2))
                    .append(',')
                    .append(decimal(result.supply(), 2))
                    .append(',')
                    .append(decimal(result.stress(), 4));
            if (withUnmet) {
                sb.append(',').append(result.unmetDemand() != null ? decimal(result.unmetDemand(), 2) : "");
            }
        }
        return sb.toString();
    }

    public static String topRegions(List<SimulationSummary.TopStressedRegion> regions) {
        StringBuilder sb = new StringBuilder(TOP_REGIONS_HEADER);
        int rank = 1;
        for (SimulationSummary.TopStressedRegion region : regions) {
            sb.append('\n')
                    .append(rank++)
                    .append(',')
                    .append(nullToEmpty(region.regionId()))
                    .append(',')
                    .append(quote(region.regionName()))
                    .append(',')
                    .append(decimal(region.avgStress(), 4));
        }
        return sb.toString();
    }

    static String quote(String value) {
        return '"' + nullToEmpty(value).replace("\"", "\"\"") + '"';
    }

    static String decimal(double value, int scale) {
        if (!Double.isFinite(value)) {
            value = 0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
