// file: src/main/java/io/decaylite/storage/UserLock.java
package io.decaylite.storage;

import java.util.Objects;

/** Key of a user point: the lock owner and the global lock id. */
public record UserLock(String user, long lockId) {
    public UserLock {
        Objects.requireNonNull(user, "user");
        if (user.isBlank()) throw new IllegalArgumentException("user must not be blank");
    }
}
