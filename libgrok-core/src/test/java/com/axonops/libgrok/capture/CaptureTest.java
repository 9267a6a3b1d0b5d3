/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libgrok.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class CaptureTest {

    @Test
    void newCapture_hasUnsetSentinels() {
        Capture c = new Capture();

        assertThat(c.getId()).isEqualTo(Capture.NOT_SET);
        assertThat(c.getCaptureNumber()).isEqualTo(Capture.NOT_SET);
        assertThat(c.getName()).isNull();
        assertThat(c.getSubname()).isNull();
        assertThat(c.getPattern()).isNull();
        assertThat(c.hasPredicate()).isFalse();
        assertThat(c.getExtra()).isNull();
        assertThat(c.isReleased()).isFalse();
    }

    @Test
    void builder_populatesFields() {
        Object handle = new Object();
        Capture c = Capture.builder()
            .id(3)
            .captureNumber(5)
            .name("IP:client")
            .subname("client")
            .pattern("(?:%{IPV6}|%{IPV4})")
            .predicate("libnet.so", "in_subnet")
            .extra(handle)
            .build();

        assertThat(c.getId()).isEqualTo(3);
        assertThat(c.getCaptureNumber()).isEqualTo(5);
        assertThat(c.getSubname()).isEqualTo("client");
        assertThat(c.getPredicateLib()).isEqualTo("libnet.so");
        assertThat(c.getPredicateFunc()).isEqualTo("in_subnet");
        assertThat(c.hasPredicate()).isTrue();
        assertThat(c.getExtra()).isSameAs(handle);
    }

    @Test
    void builder_buildTwice_independentInstances() {
        Capture.Builder builder = Capture.builder().id(1).name("A");

        Capture first = builder.build();
        Capture second = builder.name("B").build();

        assertThat(first.getName()).isEqualTo("A");
        assertThat(second.getName()).isEqualTo("B");
    }

    @Test
    void copy_isIndependent_extraSharedByReference() {
        Object handle = new Object();
        Capture original = Capture.builder().id(1).name("A").extra(handle).build();

        Capture copy = original.copy();
        copy.setName("B");

        assertThat(original.getName()).isEqualTo("A");
        assertThat(copy.getExtra()).isSameAs(handle);
    }

    @Test
    void release_dropsOwnedFields_keepsEmptySentinel() {
        Capture c = Capture.builder()
            .id(1)
            .name("IP:client")
            .subname(Capture.EMPTY)
            .pattern("x")
            .predicate("lib", "fn")
            .extra(new Object())
            .build();

        c.release();

        assertThat(c.isReleased()).isTrue();
        assertThat(c.getName()).isNull();
        assertThat(c.getSubname()).isSameAs(Capture.EMPTY);
        assertThat(c.getPattern()).isNull();
        assertThat(c.getPredicateLib()).isNull();
        assertThat(c.getPredicateFunc()).isNull();
        assertThat(c.getExtra()).isNull();
        assertThat(c.getId()).isEqualTo(1);

        c.release();
        assertThat(c.getSubname()).isSameAs(Capture.EMPTY);
    }

    @Test
    void getExtra_wrongType_throws() {
        Capture c = Capture.builder().extra("text").build();

        assertThatThrownBy(() -> c.getExtra(Integer.class)).isInstanceOf(ClassCastException.class);
        assertThat(c.getExtra(String.class)).isEqualTo("text");
    }

    @Test
    void toString_hashesPattern() {
        Capture c = Capture.builder().id(1).name("A").pattern("secret-ish").build();

        assertThat(c.toString()).contains("id=1").doesNotContain("secret-ish");
    }

    // ========== CaptureNames ==========

    @ParameterizedTest
    @CsvSource({
        "IP:client, client, true",
        "IP, IP, false",
        "DATA:x:y, x:y, true",
        "':', '', true"
    })
    void captureNames_subnameAndRename(String name, String subname, boolean renamed) {
        assertThat(CaptureNames.subnameOf(name, ":")).isEqualTo(subname);
        assertThat(CaptureNames.isRenamed(name, ":")).isEqualTo(renamed);
    }

    @Test
    void captureNames_nullName() {
        assertThat(CaptureNames.subnameOf(null, ":")).isSameAs(Capture.EMPTY);
        assertThat(CaptureNames.isRenamed(null, ":")).isFalse();
    }
}
