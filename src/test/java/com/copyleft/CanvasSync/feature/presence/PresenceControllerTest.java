package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.presence.dto.MemberView;
import com.copyleft.CanvasSync.feature.presence.dto.PresenceSummaryResponse;
import com.copyleft.CanvasSync.feature.presence.dto.RoomPresenceResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PresenceControllerTest {

    private static final String DESIGN_ID = "507f1f77bcf86cd799439011";

    @InjectMocks
    private PresenceController presenceController;

    @Mock
    private PresenceService presenceService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(presenceController).build();
    }

    @Test
    @DisplayName("전체 방 수와 멤버 수를 돌려준다")
    void summary() throws Exception {
        when(presenceService.getSummary()).thenReturn(PresenceSummaryResponse.builder().rooms(2).members(5).build());

        mockMvc.perform(get("/api/presence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rooms").value(2))
                .andExpect(jsonPath("$.members").value(5));
    }

    @Test
    @DisplayName("방 멤버 목록을 돌려주고, 대문자 ID 도 같은 방으로 본다")
    void room_Found() throws Exception {
        when(presenceService.getRoomPresence(DESIGN_ID)).thenReturn(Optional.of(RoomPresenceResponse.builder()
                .designId(DESIGN_ID)
                .members(List.of(MemberView.builder().id("user_1_abc").name("alice").color("#FF6B6B").build()))
                .build()));

        mockMvc.perform(get("/api/presence/{designId}", DESIGN_ID.toUpperCase()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.designId").value(DESIGN_ID))
                .andExpect(jsonPath("$.members[0].name").value("alice"))
                .andExpect(jsonPath("$.members[0].cursor").doesNotExist());
    }

    @Test
    @DisplayName("없는 방이면 404 를 돌려준다")
    void room_NotFound() throws Exception {
        when(presenceService.getRoomPresence("unknown")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/presence/{designId}", "unknown"))
                .andExpect(status().isNotFound());
    }
}
