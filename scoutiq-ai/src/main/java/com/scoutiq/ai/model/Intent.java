package com.scoutiq.ai.model;

import com.scoutiq.common.enums.IntentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Intent {

    private IntentType type;

    @Builder.Default
    private Set<String> safetyFlags = new LinkedHashSet<>();

    public static Intent of(IntentType type, Set<String> safetyFlags) {
        return new Intent(type, new LinkedHashSet<>(safetyFlags));
    }

    public boolean isOutOfScope() {
        return type == IntentType.OUT_OF_SCOPE;
    }
}
