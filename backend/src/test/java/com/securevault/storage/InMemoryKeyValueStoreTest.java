package com.securevault.storage;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    void missingKeyIsEmpty() {
        StepVerifier.create(store.get("absent")).verifyComplete();
    }

    @Test
    void storedBytesAreCopiedInAndOut() {
        byte[] value = {1, 2, 3};
        store.set("k", value).block();
        value[0] = 9;

        byte[] read = store.get("k").block();
        assertArrayEquals(new byte[]{1, 2, 3}, read);

        read[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, store.get("k").block());
    }

    @Test
    void multiKeyWriteAndDelete() {
        store.setAll(Map.of("a", new byte[]{1}, "b", new byte[]{2})).block();
        assertArrayEquals(new byte[]{2}, store.get("b").block());

        store.deleteAll(List.of("a", "b", "never-set")).block();

        StepVerifier.create(store.get("a")).verifyComplete();
        StepVerifier.create(store.get("b")).verifyComplete();
    }

    @Test
    void deleteIsIdempotent() {
        store.set("k", new byte[]{1}).block();

        StepVerifier.create(store.delete("k")).verifyComplete();
        StepVerifier.create(store.delete("k")).verifyComplete();
        StepVerifier.create(store.get("k")).verifyComplete();
    }
}
