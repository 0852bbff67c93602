package com.copyleft.CanvasSync.feature.presence;

import com.copyleft.CanvasSync.feature.presence.dto.PresenceSummaryResponse;
import com.copyleft.CanvasSync.feature.presence.dto.RoomPresenceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * 운영 확인용 읽기 전용 조회 API
 */
@RestController
@RequestMapping("/api/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final PresenceService presenceService;

    @GetMapping
    public PresenceSummaryResponse summary() {
        return presenceService.getSummary();
    }

    @GetMapping("/{designId}")
    public ResponseEntity<RoomPresenceResponse> room(@PathVariable String designId) {
        return presenceService.getRoomPresence(designId.toLowerCase(Locale.ROOT))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
