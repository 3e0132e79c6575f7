package com.kotsin.turnengine.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive payload for host-side display. The host renders and localizes {@link #code}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnNotification {

    private String code;
    private String characterId;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    public static TurnNotification of(String code, String characterId, Map<String, ?> params) {
        return TurnNotification.builder()
            .code(code)
            .characterId(characterId)
            .params(new LinkedHashMap<>(params))
            .build();
    }
}
