package org.nowstart.avwap.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NasdaqEarningsSurpriseResponse(
        Data data
) {

    public List<Row> rowsOrEmpty() {
        if (data == null || data.earningsSurpriseTable() == null || data.earningsSurpriseTable().rows() == null) {
            return List.of();
        }
        return data.earningsSurpriseTable().rows();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            Table earningsSurpriseTable
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Table(
            List<Row> rows
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Row(
            String dateReported
    ) {
    }
}
