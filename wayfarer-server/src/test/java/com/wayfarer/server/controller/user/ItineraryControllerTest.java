package com.wayfarer.server.controller.user;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.result.ErrorCode;
import com.wayfarer.pojo.dto.ItinerarySaveDTO;
import com.wayfarer.pojo.vo.ItineraryVO;
import com.wayfarer.server.handler.GlobalExceptionHandler;
import com.wayfarer.server.service.ItineraryService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ItineraryControllerTest {

    @Mock
    private ItineraryService itineraryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ItineraryController(itineraryService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        BaseContext.clear();
    }

    @Test
    void save_shouldRejectMissingPlan_throughValidation() throws Exception {
        BaseContext.setCurrentId(7L);

        mockMvc.perform(post("/user/travel/itineraries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\": \"Kyoto\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_PARAM.getCode()))
                .andExpect(jsonPath("$.msg").value(endsWith("plan is required")));

        verifyNoInteractions(itineraryService);
    }

    @Test
    void save_shouldRequireLogin() throws Exception {
        mockMvc.perform(post("/user/travel/itineraries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\": \"Kyoto\", \"plan\": {\"title\": \"Autumn\"}}"))
                .andExpect(jsonPath("$.code").value(ErrorCode.NOT_LOGGED_IN.getCode()));

        verifyNoInteractions(itineraryService);
    }

    @Test
    void save_shouldReturnSavedItinerary_forLoggedInUser() throws Exception {
        BaseContext.setCurrentId(7L);
        ItineraryVO vo = new ItineraryVO();
        vo.setId(11L);
        vo.setMediaStatus("pending");
        when(itineraryService.saveItinerary(eq(7L), any(ItinerarySaveDTO.class))).thenReturn(vo);

        mockMvc.perform(post("/user/travel/itineraries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\": \"Kyoto\", \"plan\": {\"title\": \"Autumn\"}}"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.data.id").value(11))
                .andExpect(jsonPath("$.data.mediaStatus").value("pending"));
    }

    @Test
    void latest_shouldRequireLogin() throws Exception {
        mockMvc.perform(get("/user/travel/itineraries/latest"))
                .andExpect(jsonPath("$.code").value(ErrorCode.NOT_LOGGED_IN.getCode()));
    }
}
