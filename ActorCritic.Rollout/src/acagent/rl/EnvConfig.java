package acagent.rl;

import java.util.Locale;

/**
 * Environment-variable parsing helpers shared by the agent configuration.
 *
 * A JVM system property named after the key (lower-cased, {@code AC_} prefix
 * dropped, underscores turned into dots) takes precedence over the environment,
 * so {@code -Dac.discount=0.9} overrides {@code AC_DISCOUNT}. Malformed values
 * fall back to the default.
 */
public final class EnvConfig {

    private EnvConfig() {
    }

    static String propertyName(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        if (k.startsWith("ac_")) {
            k = "ac." + k.substring(3);
        }
        return k.replace('_', '.');
    }

    public static String str(String key, String def) {
        String v = System.getProperty(propertyName(key));
        if (v == null) {
            v = System.getenv(key);
        }
        if (v == null) {
            return def;
        }
        v = v.trim();
        return v.isEmpty() ? def : v;
    }

    public static int i32(String key, int def) {
        String v = str(key, null);
        if (v == null) {
            return def;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ignored) {
            return def;
        }
    }

    public static long i64(String key, long def) {
        String v = str(key, null);
        if (v == null) {
            return def;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException ignored) {
            return def;
        }
    }

    public static double f64(String key, double def) {
        String v = str(key, null);
        if (v == null) {
            return def;
        }
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : def;
        } catch (NumberFormatException ignored) {
            return def;
        }
    }

    public static boolean bool(String key, boolean def) {
        String v = str(key, null);
        if (v == null) {
            return def;
        }
        if ("1".equals(v) || "true".equalsIgnoreCase(v) || "yes".equalsIgnoreCase(v)) {
            return true;
        }
        if ("0".equals(v) || "false".equalsIgnoreCase(v) || "no".equalsIgnoreCase(v)) {
            return false;
        }
        return def;
    }
}
