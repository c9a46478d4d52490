package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.NormativeProvision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.regulatory.conflict.support.ProvisionFixtures.requires;
import static org.junit.jupiter.api.Assertions.*;

class ProvisionIndexTest {

    @Nested
    @DisplayName("DefaultBucketingStrategy")
    class Bucketing {

        private final DefaultBucketingStrategy strategy = new DefaultBucketingStrategy();

        @Test
        @DisplayName("Should key by topic and top-level jurisdiction")
        void testKeys() {
            NormativeProvision p = requires("A").topicTags("Data-Breach", "privacy")
                    .jurisdiction("US/CA", "EU/DE").build();

            Set<BucketKey> keys = strategy.bucketKeys(p);

            assertEquals(Set.of(
                    new BucketKey("data-breach", "US"), new BucketKey("data-breach", "EU"),
                    new BucketKey("privacy", "US"), new BucketKey("privacy", "EU")), keys);
        }

        @Test
        @DisplayName("Provisions without jurisdiction get the wildcard key")
        void testWildcard() {
            Set<BucketKey> keys = strategy.bucketKeys(requires("A").jurisdiction(Set.of()).build());
            assertEquals(Set.of(BucketKey.wildcard("data-breach")), keys);
            assertEquals("data-breach|*", keys.iterator().next().toString());
        }

        @Test
        @DisplayName("Provisions without topics get no key")
        void testNoTopic() {
            assertTrue(strategy.bucketKeys(requires("A").topicTags(Set.of()).build()).isEmpty());
        }
    }

    private ProvisionIndex index;

    @BeforeEach
    void setUp() {
        index = new ProvisionIndex(new DefaultBucketingStrategy());
    }

    @Test
    @DisplayName("Parent and child jurisdictions share a bucket")
    void testNestedJurisdictionsShareBucket() {
        index.put(requires("A").jurisdiction("US").build());
        index.put(requires("B").jurisdiction("US/CA").build());
        index.put(requires("C").jurisdiction("EU").build());

        assertEquals(List.of("B"), ids(index.candidatesFor("A")));
        assertTrue(index.candidatesFor("C").isEmpty());
    }

    @Test
    @DisplayName("Wildcard provisions are candidates of every bucket of their topic")
    void testWildcardCandidates() {
        index.put(requires("A").jurisdiction("US").build());
        index.put(requires("B").jurisdiction("EU").build());
        index.put(requires("W").jurisdiction(Set.of()).build());

        assertEquals(List.of("A", "B"), ids(index.candidatesFor("W")));
        assertEquals(List.of("W"), ids(index.candidatesFor("A")));
        assertTrue(index.buckets().get(new BucketKey("data-breach", "EU")).stream()
                .anyMatch(p -> p.getId().equals("W")));
    }

    @Test
    @DisplayName("Putting an indexed id again replaces its buckets")
    void testReplace() {
        index.put(requires("A").jurisdiction("US").build());
        index.put(requires("A").jurisdiction("EU").build());

        assertEquals(1, index.size());
        assertEquals(Set.of(new BucketKey("data-breach", "EU")), index.keysOf("A"));
        assertFalse(index.buckets().containsKey(new BucketKey("data-breach", "US")));
    }

    @Test
    @DisplayName("Removing a provision drops it from every bucket")
    void testRemove() {
        index.put(requires("A").build());
        index.put(requires("B").build());

        assertTrue(index.remove("A").isPresent());
        assertTrue(index.get("A").isEmpty());
        assertTrue(index.candidatesFor("B").isEmpty());
        assertTrue(index.remove("A").isEmpty());
    }

    private static List<String> ids(List<NormativeProvision> provisions) {
        return provisions.stream().map(NormativeProvision::getId).toList();
    }
}
