package com.example.formstructure.controller;

import com.example.formstructure.service.FormStructureService;
import com.example.formstructure.util.structure.DuplicateDetectionException;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.FormStructureResult;
import com.example.formstructure.util.structure.dto.HierarchyResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.File;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.example.formstructure.DetectionFixtures.detection;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FormStructureController.class)
@DisplayName("FormStructureController")
class FormStructureControllerTest {

    private static final String DETECTIONS = "["
            + "{\"detection_id\": \"s1\", \"class\": \"section\", \"x\": 100, \"y\": 50, \"width\": 200, \"height\": 100},"
            + "{\"detection_id\": \"f1\", \"class\": \"field\", \"x\": 100, \"y\": 60, \"width\": 20, \"height\": 10, \"text\": \"Name\"}"
            + "]";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FormStructureService formStructureService;

    @Test
    @DisplayName("POST /hierarchy 返回文档树和统计")
    void shouldReturnHierarchy() throws Exception {
        DocumentNode root = DocumentNode.root();
        DocumentNode section = DocumentNode.of(detection("s1", DetectionClass.SECTION, 100, 50, 200, 100), null);
        section.addChild(DocumentNode.of(detection("f1", DetectionClass.FIELD, 100, 60, 20, 10, "Name"), "Name"));
        root.addChild(section);
        when(formStructureService.buildHierarchy(anyList()))
                .thenReturn(new HierarchyResult(root, Collections.singletonList("skipped z1")));

        mockMvc.perform(post("/api/form-structure/hierarchy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DETECTIONS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.hierarchy.type").value("document"))
                .andExpect(jsonPath("$.hierarchy.children[0].id").value("s1"))
                .andExpect(jsonPath("$.hierarchy.children[0].box").value("100 50 200 100"))
                .andExpect(jsonPath("$.hierarchy.children[0].children[0].text").value("Name"))
                .andExpect(jsonPath("$.warnings[0]").value("skipped z1"))
                .andExpect(jsonPath("$.stats.total_nodes").value(2));
    }

    @Test
    @DisplayName("POST /hierarchy 请求体不是合法 JSON 时返回 400")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/form-structure/hierarchy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"detections\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(formStructureService, never()).buildHierarchy(anyList());
    }

    @Test
    @DisplayName("POST /hierarchy 重复ID返回 400")
    void shouldRejectDuplicateIds() throws Exception {
        when(formStructureService.buildHierarchy(anyList())).thenThrow(new DuplicateDetectionException("s1"));

        mockMvc.perform(post("/api/form-structure/hierarchy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DETECTIONS))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("s1")));
    }

    @Test
    @DisplayName("POST /process 返回各阶段产物")
    void shouldReturnProcessResult() throws Exception {
        FormStructureResult result = new FormStructureResult();
        result.setHierarchy(DocumentNode.root());
        result.setFinalHierarchy(DocumentNode.root());
        result.setWarnings(Collections.<String>emptyList());
        result.setStats(Collections.<String, Object>singletonMap("table_count", 0));
        when(formStructureService.processJson(anyString())).thenReturn(result);

        mockMvc.perform(post("/api/form-structure/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DETECTIONS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.final_hierarchy.type").value("document"))
                .andExpect(jsonPath("$.result.stats.table_count").value(0));
    }

    @Test
    @DisplayName("POST /process 未预期的异常返回 500")
    void shouldReturnServerErrorOnUnexpectedFailure() throws Exception {
        when(formStructureService.processJson(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/form-structure/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DETECTIONS))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("POST /process-file 写入任务目录")
    void shouldProcessUploadedFile() throws Exception {
        Map<String, Object> output = new HashMap<>();
        output.put("taskId", "abc123");
        output.put("taskDir", "/data/form_structure/abc123");
        output.put("warnings", Collections.emptyList());
        when(formStructureService.processToDirectory(anyString(), any(File.class))).thenReturn(output);

        MockMultipartFile file = new MockMultipartFile("file", "page1.json",
                MediaType.APPLICATION_JSON_VALUE, DETECTIONS.getBytes("UTF-8"));

        mockMvc.perform(multipart("/api/form-structure/process-file").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.taskId").value("abc123"))
                .andExpect(jsonPath("$.originalFilename").value("page1.json"));
    }

    @Test
    @DisplayName("POST /process-file 结果写盘失败返回 500")
    void shouldReturnServerErrorWhenTaskDirCannotBeWritten() throws Exception {
        when(formStructureService.processToDirectory(anyString(), any(File.class)))
                .thenThrow(new IllegalStateException("无法创建任务目录: /data/form_structure/abc123"));

        MockMultipartFile file = new MockMultipartFile("file", "page1.json",
                MediaType.APPLICATION_JSON_VALUE, DETECTIONS.getBytes("UTF-8"));

        mockMvc.perform(multipart("/api/form-structure/process-file").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message", containsString("abc123")));
    }

    @Test
    @DisplayName("POST /process-file 只接受 .json 文件")
    void shouldRejectNonJsonUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "page1.png",
                MediaType.IMAGE_PNG_VALUE, new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/form-structure/process-file").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(formStructureService, never()).processToDirectory(anyString(), any(File.class));
    }

    @Test
    @DisplayName("POST /reorganize 返回重组后的层级")
    void shouldReturnReorganizedHierarchy() throws Exception {
        DocumentNode root = DocumentNode.root();
        root.addChild(DocumentNode.of(detection("s1", DetectionClass.SECTION, 100, 50, 200, 100), null));
        when(formStructureService.reorganize(anyList()))
                .thenReturn(new HierarchyResult(root, Collections.<String>emptyList()));

        mockMvc.perform(post("/api/form-structure/reorganize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(DETECTIONS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hierarchy.children[0].id").value("s1"))
                .andExpect(jsonPath("$.hierarchy.children[0].text").doesNotExist());
    }
}
