package com.architecture.design.nodeforge.controller;

import com.architecture.design.nodeforge.dto.ConversionRequest;
import com.architecture.design.nodeforge.dto.ConversionResponse;
import com.architecture.design.nodeforge.dto.ConversionStats;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.exception.ThemeConfigurationException;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.service.ConversionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversionController.class)
class ConversionControllerTest {

    private static final String VALID_BODY = "{"
            + "\"root\": {\"id\": \"root\", \"type\": \"column\", \"children\": ["
            + "  {\"id\": \"t1\", \"type\": \"text\", \"properties\": {\"data\": \"Hello\", \"flex\": 1}}"
            + "]},"
            + "\"styleConfig\": {\"useVariables\": false}"
            + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversionService conversionService;

    @Test
    void returnsConversionResult_forValidRequest() throws Exception {
        ConversionResponse response = ConversionResponse.builder()
                .success(true)
                .root(TargetNodeSpec.builder().id("node_1").type(TargetNodeType.FRAME).name("Column").build())
                .stats(ConversionStats.builder().widgetsFound(2).widgetsConverted(2).build())
                .build();
        when(conversionService.convert(any(ConversionRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.root.id").value("node_1"))
                .andExpect(jsonPath("$.root.type").value("FRAME"))
                .andExpect(jsonPath("$.stats.successRate").value(100.0));

        ArgumentCaptor<ConversionRequest> captor = ArgumentCaptor.forClass(ConversionRequest.class);
        verify(conversionService).convert(captor.capture());
        ConversionRequest request = captor.getValue();
        assertThat(request.getRoot().getType()).isEqualTo(WidgetType.COLUMN);
        assertThat(request.getRoot().getChildren()).singleElement().satisfies(child -> {
            assertThat(child.getType()).isEqualTo(WidgetType.TEXT);
            assertThat(child.literalText()).isEqualTo("Hello");
            assertThat(child.getProperties().getNumber("flex")).isEqualTo(1d);
        });
        assertThat(request.getStyleConfig().isUseVariables()).isFalse();
        assertThat(request.getStyleConfig().getCollectionPrefix()).isEqualTo("Default");
    }

    @Test
    void rejectsRequestWithoutRoot() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"themes\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.details", hasItem("root: root widget is required")));

        verifyNoInteractions(conversionService);
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"root\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    void mapsThemeConfigurationErrorToBadRequest() throws Exception {
        when(conversionService.convert(any(ConversionRequest.class)))
                .thenThrow(new ThemeConfigurationException("Duplicate mode name: Light"));

        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Invalid theme configuration"))
                .andExpect(jsonPath("$.message").value("Duplicate mode name: Light"));
    }
}
