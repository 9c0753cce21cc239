package com.signalpro.signal.service;

import com.signalpro.chart.model.ChartSeries;
import com.signalpro.chart.service.TrajectorySynthesizer;
import com.signalpro.output.config.OutputConfig;
import com.signalpro.output.dto.GeneratedPage;
import com.signalpro.output.service.SignalPageWriter;
import com.signalpro.render.service.DocumentCompositor;
import com.signalpro.signal.dto.SuiteResponse;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.service.SampleSignalCatalog.SampleSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 範例套組產生服務
 *
 * 每則範例：合成走勢 → 套上 eventLabel → 組版 → 寫到套組目錄，
 * 檔名用預設的 TICKER_kind.html（重跑會覆蓋）。
 * 任何一則失敗就整批中止，例外直接往上拋。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalSuiteService {

    private final TrajectorySynthesizer trajectorySynthesizer;
    private final DocumentCompositor documentCompositor;
    private final SignalPageWriter pageWriter;
    private final OutputConfig outputConfig;

    public SuiteResponse generateSuite() {
        return generate(SampleSignalCatalog.all());
    }

    SuiteResponse generate(List<SampleSignal> samples) {
        List<GeneratedPage> pages = new ArrayList<>();
        int index = 0;
        for (SampleSignal sample : samples) {
            index++;
            SignalRecord base = sample.signal();
            log.info("[{}/{}] 產生範例 {} ({})", index, samples.size(), base.getTicker(), base.getKind());

            ChartSeries series = trajectorySynthesizer
                    .synthesize(base.getTicker(), base.getCurrentPrice(), sample.pattern());
            if (sample.eventLabel() != null) {
                series = series.withEventLabel(sample.eventLabel());
            }

            SignalRecord signal = base.toBuilder().chartSeries(series).build();
            String html = documentCompositor.compose(signal);
            pages.add(pageWriter.write(outputConfig.getSuiteDirectory(),
                    SignalPageWriter.defaultFilename(signal), html));
        }

        long totalSize = pages.stream().mapToLong(GeneratedPage::getFileSize).sum();
        log.info("範例套組完成: {} 頁, 共 {} bytes", pages.size(), totalSize);
        return SuiteResponse.builder()
                .generatedCount(pages.size())
                .totalSize(totalSize)
                .outputDirectory(outputConfig.getSuiteDirectory().toString())
                .pages(pages)
                .build();
    }
}
