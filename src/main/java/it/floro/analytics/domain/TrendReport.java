package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrendReport(
        int window,
        SlopeUnit slopeUnit,
        double confidenceLevel,
        List<TrendSegment> segments
) {

    public TrendReport {
        segments = List.copyOf(segments);
    }
}
