package org.nowstart.avwap.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NasdaqEarningsCalendarResponse(
        Data data
) {

    public List<Row> rowsOrEmpty() {
        if (data == null || data.rows() == null) {
            return List.of();
        }
        return data.rows();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            List<Row> rows
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Row(
            String symbol
    ) {
    }
}
