package org.nowstart.avwap.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.dto.AvwapRunSummaryDto;
import org.nowstart.avwap.data.dto.AvwapSignalDto;
import org.nowstart.avwap.data.dto.AvwapSignalReportDto;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.data.type.AnchorRole;
import org.nowstart.avwap.data.type.SignalCategory;
import org.nowstart.avwap.signal.core.AvwapRunReport;
import org.nowstart.avwap.signal.core.AvwapSignal;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AvwapSignalReportService {

    private static final DateTimeFormatter COMPLETED_AT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Path outputPath;

    @Autowired
    public AvwapSignalReportService(AvwapProperties avwapProperties) {
        this(Path.of(avwapProperties.outputFile()));
    }

    AvwapSignalReportService(Path outputPath) {
        this.outputPath = outputPath;
    }

    public String render(AvwapRunReport report) {
        StringBuilder text = new StringBuilder();
        text.append("# CURRENT ANCHOR\n");
        appendSections(text, report, AnchorRole.CURRENT);
        text.append("# PREVIOUS ANCHOR\n");
        appendSections(text, report, AnchorRole.PREVIOUS);
        text.append("Run completed at ").append(COMPLETED_AT.format(report.completedAt())).append('\n');
        return text.toString();
    }

    public String write(AvwapRunReport report) {
        String text = render(report);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write signal log " + outputPath, e);
        }
        log.info("Signal log written. path={}, signals={}", outputPath, report.signals().size());
        return text;
    }

    public AvwapRunSummaryDto toSummary(AvwapRunReport report) {
        return new AvwapRunSummaryDto(
                report.symbolCount(),
                report.signals().size(),
                report.signals().counts(),
                report.skippedSymbols(),
                report.completedAt()
        );
    }

    public AvwapSignalReportDto toReportDto(AvwapRunReport report) {
        List<AvwapSignalDto> signals = new ArrayList<>();
        for (SignalCategory category : SignalCategory.values()) {
            for (AvwapSignal signal : report.signals().get(category)) {
                signals.add(new AvwapSignalDto(category, signal.symbol(), signal.date(), signal.label(), signal.side()));
            }
        }
        return new AvwapSignalReportDto(report.completedAt(), signals, report.skippedSymbols(), render(report));
    }

    private void appendSections(StringBuilder text, AvwapRunReport report, AnchorRole role) {
        for (SignalCategory category : SignalCategory.forRole(role)) {
            List<AvwapSignal> rows = report.signals().get(category);
            if (rows.isEmpty()) {
                continue;
            }
            rows.forEach(row -> text.append(row.toLogLine()).append('\n'));
            text.append('\n');
        }
    }
}
