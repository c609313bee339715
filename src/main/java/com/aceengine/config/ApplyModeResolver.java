package com.aceengine.config;

import com.aceengine.core.error.InvalidArgsException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves how approved plans are handled.
 *
 * AUTO    — plans scoring at or above the auto threshold are committed;
 *           plans in the suggest band are recorded as suggestions.
 * SUGGEST — nothing is committed; every approved plan is recorded as a suggestion.
 */
@Component
public class ApplyModeResolver {

    public enum ApplyMode { AUTO, SUGGEST }

    private final ApplyMode mode;

    public ApplyModeResolver(
        @Value("${ace.policy.mode:auto}") String mode
    ) {
        this.mode = parse(mode);
    }

    static ApplyMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        for (ApplyMode candidate : ApplyMode.values()) {
            if (candidate.name().equals(normalized)) return candidate;
        }
        throw new InvalidArgsException("Unknown ace.policy.mode '" + raw + "' (expected auto or suggest)");
    }

    public boolean isAuto() {
        return mode == ApplyMode.AUTO;
    }

    public boolean isSuggestOnly() {
        return mode == ApplyMode.SUGGEST;
    }

    public ApplyMode getMode() {
        return mode;
    }
}
