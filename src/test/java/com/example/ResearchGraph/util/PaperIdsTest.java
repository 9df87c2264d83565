package com.example.ResearchGraph.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaperIdsTest {

    private static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    @Test
    void nameBasedMatchesRfc4122Version5() {
        UUID id = PaperIds.nameBased(NAMESPACE_DNS, "python.org");

        assertEquals(UUID.fromString("886313e1-3b8a-5372-9b90-0c9aee199e5d"), id);
        assertEquals(5, id.version());
        assertEquals(2, id.variant());
    }

    @Test
    void arxivIdMapsToStableId() {
        UUID first = PaperIds.fromArxivId("1706.03762");
        UUID again = PaperIds.fromArxivId("1706.03762");

        assertEquals(first, again);
        assertNotEquals(first, PaperIds.fromArxivId("1810.04805"));
    }

    @Test
    void stripVersionRemovesPrefixAndSuffix() {
        assertEquals("2401.01234", PaperIds.stripVersion("2401.01234v2"));
        assertEquals("2401.01234", PaperIds.stripVersion(" arXiv:2401.01234v10 "));
        assertEquals("hep-th/9901001", PaperIds.stripVersion("hep-th/9901001v1"));
        assertEquals("2401.01234", PaperIds.stripVersion("2401.01234"));
    }

    @Test
    void parseUuidRejectsArxivIds() {
        UUID id = UUID.randomUUID();

        assertEquals(Optional.of(id), PaperIds.parseUuid(" " + id + " "));
        assertTrue(PaperIds.parseUuid("2401.01234").isEmpty());
        assertTrue(PaperIds.parseUuid("").isEmpty());
        assertTrue(PaperIds.parseUuid(null).isEmpty());
    }
}
