package com.example.redismanager.codec;

import com.example.redismanager.error.ManagerException;

/**
 * Maps logical keys to the {@code namespace:key} form stored in Redis and back.
 */
public class PrefixCodec {

    private static final String SEPARATOR = ":";
    private static final String LOCK_PREFIX = "lock:";

    private final String namespace;
    private final String prefix;

    public PrefixCodec(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        this.namespace = namespace;
        this.prefix = namespace + SEPARATOR;
    }

    public String namespace() { return namespace; }

    public String concat(String key) {
        if (key == null) {
            throw ManagerException.invalidKey("Key must be a string, got null.");
        }
        if (key.isEmpty()) {
            throw ManagerException.invalidKey("Key must not be empty.");
        }
        return prefix + key;
    }

    public String split(String prefixedKey) {
        if (prefixedKey == null || !prefixedKey.startsWith(prefix)) {
            throw ManagerException.invalidKey("Key " + prefixedKey + " is not in namespace " + namespace + ".");
        }
        return prefixedKey.substring(prefix.length());
    }

    public String lockResource(String prefixedKey) {
        return LOCK_PREFIX + prefixedKey;
    }

    /** Glob matching every key of this namespace. */
    public String pattern() {
        StringBuilder glob = new StringBuilder(prefix.length() + 8);
        for (char c : prefix.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                glob.append('\\');
            }
            glob.append(c);
        }
        return glob.append('*').toString();
    }
}
