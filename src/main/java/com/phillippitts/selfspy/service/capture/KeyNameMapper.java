package com.phillippitts.selfspy.service.capture;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Utility for canonicalizing key, modifier and button names so every capture adapter
 * records the same text for the same input.
 */
public final class KeyNameMapper {

    private static final Set<String> MODIFIER_KEYS = Set.of("META", "SHIFT", "CONTROL", "ALT",
            "LEFT_META", "RIGHT_META", "LEFT_SHIFT", "RIGHT_SHIFT", "LEFT_CONTROL", "RIGHT_CONTROL",
            "LEFT_ALT", "RIGHT_ALT", "CAPS_LOCK");

    private static final Set<String> SPECIAL_KEYS = Stream.concat(
            Stream.of("ESCAPE", "ENTER", "TAB", "BACKSPACE", "DELETE", "INSERT",
                    "UP", "DOWN", "LEFT", "RIGHT", "HOME", "END", "PAGE_UP", "PAGE_DOWN"),
            IntStream.rangeClosed(1, 24).mapToObj(i -> "F" + i)
    ).collect(Collectors.toUnmodifiableSet());

    /** Modifiers that turn an ordinary key into a shortcut. */
    private static final Set<String> SHORTCUT_MODIFIERS = Set.of("CONTROL", "META", "ALT");

    private KeyNameMapper() {}

    /** Canonicalize a key name (case-insensitive, spaces to underscores, aliases). */
    public static String normalizeKey(String keyText) {
        if (keyText == null || keyText.isBlank()) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace("COMMAND", "META")
                .replace("CMD", "META")
                .replace("CTRL", "CONTROL")
                .replace("OPTION", "ALT");
        return switch (k) {
            case "ESC" -> "ESCAPE";
            case "RETURN" -> "ENTER";
            case "BACK_SPACE" -> "BACKSPACE";
            case "PAGEUP" -> "PAGE_UP";
            case "PAGEDOWN" -> "PAGE_DOWN";
            default -> k;
        };
    }

    /** Normalize a single modifier alias to canonical form. */
    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        String m = normalizeKey(mod);
        if (m.startsWith("LEFT_") || m.startsWith("RIGHT_")) {
            m = m.substring(m.indexOf('_') + 1);
        }
        return m;
    }

    /** Normalize a list of modifiers. */
    public static Set<String> normalizeModifiers(List<String> mods) {
        if (mods == null) {
            return Set.of();
        }
        return mods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .filter(m -> !m.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean isModifierKey(String key) {
        return MODIFIER_KEYS.contains(normalizeKey(key));
    }

    public static boolean isSpecialKey(String key) {
        return SPECIAL_KEYS.contains(normalizeKey(key));
    }

    /** True when the modifiers make a key press a shortcut rather than typed text. */
    public static boolean isShortcut(Set<String> modifiers) {
        return modifiers.stream().map(KeyNameMapper::normalizeModifier).anyMatch(SHORTCUT_MODIFIERS::contains);
    }

    /**
     * Recorded text for a key that does not type a character, e.g. {@code ENTER -> <[Enter]>}.
     */
    public static String keyText(String key) {
        String k = normalizeKey(key);
        String pretty = Stream.of(k.split("_"))
                .filter(p -> !p.isEmpty())
                .map(p -> p.charAt(0) + p.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
        return "<[" + pretty + "]>";
    }

    /** Canonical name for a 1-based native button number. */
    public static String buttonName(int button) {
        return switch (button) {
            case 1 -> "LEFT";
            case 2 -> "RIGHT";
            case 3 -> "MIDDLE";
            case 0 -> "";
            default -> "BUTTON" + button;
        };
    }
}
