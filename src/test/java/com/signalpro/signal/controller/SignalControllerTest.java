package com.signalpro.signal.controller;

import com.signalpro.output.dto.GeneratedFileInfo;
import com.signalpro.output.dto.GeneratedPage;
import com.signalpro.output.service.SignalPageWriter;
import com.signalpro.render.service.DocumentCompositor;
import com.signalpro.shared.exception.SignalFileNotFoundException;
import com.signalpro.signal.dto.GenerateSignalRequest;
import com.signalpro.signal.dto.GenerateSignalResponse;
import com.signalpro.signal.dto.SignalPreviewResponse;
import com.signalpro.signal.dto.SuiteResponse;
import com.signalpro.signal.model.PriorityLevel;
import com.signalpro.signal.model.SignalKind;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.service.SignalRequestMapper;
import com.signalpro.signal.service.SignalSuiteService;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * SignalController 單元測試
 *
 * 覆蓋所有端點：types, preview, generate, files, suite, download, view
 */
class SignalControllerTest {

    private SignalRequestMapper requestMapper;
    private DocumentCompositor documentCompositor;
    private SignalPageWriter pageWriter;
    private SignalSuiteService suiteService;

    private SignalController controller;

    @BeforeEach
    void setUp() {
        requestMapper = mock(SignalRequestMapper.class);
        documentCompositor = mock(DocumentCompositor.class);
        pageWriter = mock(SignalPageWriter.class);
        suiteService = mock(SignalSuiteService.class);

        controller = new SignalController(requestMapper, documentCompositor, pageWriter, suiteService);
    }

    private static SignalRecord signal() {
        return SignalRecord.builder()
                .ticker("CRCL").displayName("Circle Internet Group").kind(SignalKind.IPO_DEBUT)
                .priority(PriorityLevel.HOT)
                .currentPrice(69.0).priceChangeAbsolute(38.0).priceChangePercent(122.6)
                .build();
    }

    private static GenerateSignalRequest request() {
        GenerateSignalRequest request = new GenerateSignalRequest();
        request.setTicker("CRCL");
        request.setCompanyName("Circle Internet Group");
        request.setSignalType("IPO_DEBUT");
        request.setCurrentPrice(69.0);
        request.setChangePercent(122.6);
        return request;
    }

    // ==================== 類型 ====================

    @Test
    @DisplayName("GET /api/types — 10 種類型、4 種優先度、4 種形狀")
    @SuppressWarnings("unchecked")
    void getTypes() {
        ResponseEntity<Map<String, Object>> response = controller.getTypes();

        Map<String, Object> body = response.getBody();
        assertThat((List<Map<String, String>>) body.get("signalTypes")).hasSize(10)
                .first().satisfies(k -> {
                    assertThat(k.get("value")).isEqualTo("IPO_DEBUT");
                    assertThat(k.get("label")).isEqualTo("IPO Debut");
                });
        assertThat((List<Map<String, String>>) body.get("priorities"))
                .extracting(p -> p.get("label"))
                .containsExactly("⚡ URGENT", "🔥 HOT", "👀 WATCH", "NORMAL");
        assertThat((List<String>) body.get("chartPatterns"))
                .containsExactly("momentum", "volatile", "breakout", "decline");
    }

    // ==================== 預覽 / 產生 ====================

    @Nested
    @DisplayName("POST /api/preview 與 /api/generate")
    class PreviewAndGenerate {

        @Test
        @DisplayName("預覽 — 不組版也不寫檔")
        void preview() {
            SignalRecord signal = signal();
            SignalPreviewResponse preview = SignalPreviewResponse.builder().ticker("CRCL").build();
            when(requestMapper.toRecord(any())).thenReturn(signal);
            when(requestMapper.toPreview(signal)).thenReturn(preview);

            ResponseEntity<Map<String, Object>> response = controller.preview(request());

            assertThat(response.getBody()).containsEntry("success", true).containsEntry("preview", preview);
            verifyNoInteractions(documentCompositor, pageWriter);
        }

        @Test
        @DisplayName("產生 — 時間戳記檔名，回傳下載 / 瀏覽網址與摘要")
        void generate() {
            when(requestMapper.toRecord(any())).thenReturn(signal());
            when(documentCompositor.compose(any())).thenReturn("<html></html>");
            when(pageWriter.write(anyString(), eq("<html></html>"))).thenAnswer(inv -> GeneratedPage.builder()
                    .filename(inv.getArgument(0))
                    .filePath("web_generated/" + inv.getArgument(0))
                    .absolutePath("/srv/web_generated/" + inv.getArgument(0))
                    .fileSize(13)
                    .build());

            ResponseEntity<GenerateSignalResponse> response = controller.generate(request());

            GenerateSignalResponse body = response.getBody();
            assertThat(body.isSuccess()).isTrue();
            assertThat(body.getFilename()).matches("CRCL_ipo_debut_\\d{8}_\\d{6}\\.html");
            assertThat(body.getDownloadUrl()).isEqualTo("/download/" + body.getFilename());
            assertThat(body.getViewUrl()).isEqualTo("/view/" + body.getFilename());
            assertThat(body.getFileSize()).isEqualTo(13);
            assertThat(body.getSignalData().getTicker()).isEqualTo("CRCL");
            assertThat(body.getSignalData().getSignalType()).isEqualTo("IPO_DEBUT");
            assertThat(body.getSignalData().getPriority()).isEqualTo("HOT");
            assertThat(body.getSignalData().getFilename()).isEqualTo(body.getFilename());
        }
    }

    // ==================== 檔案 ====================

    @Nested
    @DisplayName("檔案端點")
    class FileEndpoints {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("GET /api/files — 清單與總數")
        void listFiles() {
            GeneratedFileInfo info = GeneratedFileInfo.builder().filename("A_earnings.html").build();
            when(pageWriter.listPages()).thenReturn(List.of(info));

            ResponseEntity<Map<String, Object>> response = controller.listFiles();

            assertThat(response.getBody())
                    .containsEntry("success", true)
                    .containsEntry("totalCount", 1)
                    .containsEntry("files", List.of(info));
        }

        @Test
        @DisplayName("POST /api/suite — 委派給套組服務")
        void generateSuite() {
            SuiteResponse suite = SuiteResponse.builder().generatedCount(10).build();
            when(suiteService.generateSuite()).thenReturn(suite);

            assertThat(controller.generateSuite().getBody()).isSameAs(suite);
        }

        @Test
        @DisplayName("GET /download — attachment + text/html")
        void download() throws Exception {
            Path file = tempDir.resolve("A_earnings.html");
            Files.writeString(file, "<html></html>");
            when(pageWriter.locate("A_earnings.html")).thenReturn(file);

            ResponseEntity<Resource> response = controller.download("A_earnings.html");

            assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.TEXT_HTML);
            assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
                    .startsWith("attachment")
                    .contains("A_earnings.html");
            assertThat(response.getBody().contentLength()).isEqualTo(13);
        }

        @Test
        @DisplayName("GET /view — 回傳 HTML 內容")
        void view() {
            when(pageWriter.read("A_earnings.html")).thenReturn("<html>a</html>");

            ResponseEntity<String> response = controller.view("A_earnings.html");

            assertThat(response.getBody()).isEqualTo("<html>a</html>");
            assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_HTML)).isTrue();
        }

        @Test
        @DisplayName("找不到檔案 — 例外往上拋給 handler")
        void view_notFound() {
            when(pageWriter.read("missing.html")).thenThrow(new SignalFileNotFoundException("missing.html"));

            assertThatThrownBy(() -> controller.view("missing.html"))
                    .isInstanceOf(SignalFileNotFoundException.class);
        }
    }
}
