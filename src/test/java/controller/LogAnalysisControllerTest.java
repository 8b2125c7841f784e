package controller;

import application.EvtcApplication;
import engine.EvtcTestLogBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 上传接口集成测试：完整 Spring 容器 + 真实分析器
 */
@SpringBootTest(classes = EvtcApplication.class)
@AutoConfigureMockMvc
@DisplayName("日志上传接口测试")
@Timeout(60)
class LogAnalysisControllerTest {

    private static final int GORSEVAL = 0x3C45;
    private static final long POV = 0x10;
    private static final long BOSS = 0x20;

    @Autowired
    private MockMvc mockMvc;

    private static byte[] gorsevalKill() {
        return new EvtcTestLogBuilder()
                .contentId(GORSEVAL)
                .player(POV, 1, 27, "Recorder", ":rec.1000", "1")
                .npc(BOSS, GORSEVAL, "Gorseval")
                .skill(5492, "Fire Attunement")
                .stateChange(0, 0, 9, 0, 1_700_000_000, 1_700_000_000)
                .stateChange(0, POV, 13)
                .hit(100, POV, 1, BOSS, 5492, 1234)
                .stateChange(65_100, BOSS, 4)
                .stateChange(66_000, POV, 17, 55, 13, 0)
                .toBytes();
    }

    @Test
    @DisplayName("分析接口返回战斗与结果")
    void testAnalyze() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "gorseval.evtc",
                "application/octet-stream", gorsevalKill());

        mockMvc.perform(multipart("/evtc/analyze").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.fileName").value("gorseval.evtc"))
                .andExpect(jsonPath("$.data.encounter").value("GORSEVAL"))
                .andExpect(jsonPath("$.data.outcome").value("SUCCESS"))
                .andExpect(jsonPath("$.data.challengeStatus").doesNotExist())
                .andExpect(jsonPath("$.data.logStart").value("2023-11-14T22:13:20Z"))
                .andExpect(jsonPath("$.data.duration").value("1m 06.000s"))
                .andExpect(jsonPath("$.data.players[0].accountName").value(":rec.1000"))
                .andExpect(jsonPath("$.data.agentCount").value(2))
                .andExpect(jsonPath("$.data.eventCount").value(5));
    }

    @Test
    @DisplayName("解析接口返回完整模型")
    void testParseModel() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "gorseval.evtc",
                "application/octet-stream", gorsevalKill());

        mockMvc.perform(multipart("/evtc/log").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.contentId").value(GORSEVAL))
                .andExpect(jsonPath("$.data.agents[1].kind.speciesId").value(GORSEVAL))
                .andExpect(jsonPath("$.data.skills[0].name").value("Fire Attunement"))
                .andExpect(jsonPath("$.data.events[2].payload.kind").value("PHYSICAL"));
    }

    @Test
    @DisplayName("截断的日志返回解析错误与偏移")
    void testTruncated() throws Exception {
        byte[] data = gorsevalKill();
        MockMultipartFile file = new MockMultipartFile("file", "broken.evtc",
                "application/octet-stream", Arrays.copyOf(data, data.length - 3));

        mockMvc.perform(multipart("/evtc/analyze").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(422))
                .andExpect(jsonPath("$.data.errorType").value("TRUNCATED"))
                .andExpect(jsonPath("$.data.expected").value(64))
                .andExpect(jsonPath("$.data.available").value(61));
    }

    @Test
    @DisplayName("空文件返回请求错误")
    void testEmptyUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.evtc",
                "application/octet-stream", new byte[0]);

        mockMvc.perform(multipart("/evtc/analyze").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(400));
    }
}
