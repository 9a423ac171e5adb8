package org.ifcserver.ifc.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IfcGuidTest {

    @Test
    void newGuid_is22CharsOfIfcAlphabetAndUnique() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            String guid = IfcGuid.newGuid();
            assertThat(guid).hasSize(22);
            assertThat(IfcGuid.isValid(guid)).isTrue();
            for (char c : guid.toCharArray()) {
                assertThat(IfcGuid.ALPHABET.indexOf(c)).isGreaterThanOrEqualTo(0);
            }
            seen.add(guid);
        }
        assertThat(seen).hasSize(1_000);
    }

    @Test
    void compress_nilUuidIsAllZeros() {
        assertThat(IfcGuid.compress(new UUID(0, 0))).isEqualTo("0000000000000000000000");
    }

    @Test
    void expand_restoresOriginalUuid() {
        UUID uuid = UUID.fromString("f81d4fae-7dec-11d0-a765-00a0c91e6bf6");
        String guid = IfcGuid.compress(uuid);

        assertThat(guid.charAt(0)).isEqualTo('3');
        assertThat(IfcGuid.expand(guid)).isEqualTo(uuid);
    }

    @Test
    void isValid_rejectsWrongLengthForeignCharsAndOverflowingFirstChar() {
        assertThat(IfcGuid.isValid(null)).isFalse();
        assertThat(IfcGuid.isValid("abc")).isFalse();
        assertThat(IfcGuid.isValid("000000000000000000000-")).isFalse();
        assertThat(IfcGuid.isValid("4000000000000000000000")).isFalse();
        assertThat(IfcGuid.isValid("3$$$$$$$$$$$$$$$$$$$$$")).isTrue();

        assertThatThrownBy(() -> IfcGuid.expand("not-a-guid"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
