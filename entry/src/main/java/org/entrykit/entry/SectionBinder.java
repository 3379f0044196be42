/*
 * This file is part of EntryKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) The EntryKit Authors. All Rights Reserved.
 */
package org.entrykit.entry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.config.SequenceValue;
import org.entrykit.common.config.Value;
import org.entrykit.common.config.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Binds list-shaped sections of a boot configuration to typed fragments.
 * <p>
 * Keys are matched in lower case, the way {@link org.entrykit.common.config.BootConfigLoader} emits them.
 * Unknown keys are ignored.
 *
 * @since 1.0.0
 */
public final class SectionBinder {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private SectionBinder() {
    }

    /**
     * @param boot         The boot configuration.
     * @param section      Name of the section.
     * @param fragmentType Type of the section's elements.
     * @return The fragments in declaration order. Empty when the section is absent.
     * @throws ConfigParseException When the section is not a list, or an element does not fit {@code fragmentType}.
     */
    public static <T> List<T> bindList(MappingValue boot, String section, Class<T> fragmentType) throws ConfigParseException {
        requireNonNull(boot, "boot must not be null");
        requireNonNull(section, "section must not be null");
        requireNonNull(fragmentType, "fragmentType must not be null");

        final Value sectionValue = boot.get(section);
        if (sectionValue == null || sectionValue.isAbsent()) {
            return List.of();
        }
        if (!(sectionValue instanceof final SequenceValue sequence)) {
            throw new ConfigParseException("Section %s must be a list, but is a %s".formatted(
                    section, sectionValue.kind().name().toLowerCase(Locale.ROOT)));
        }

        final var fragments = new ArrayList<T>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            final Value element = Values.lowerCaseKeys(sequence.get(i));
            if (element.isAbsent()) {
                continue;
            }

            try {
                fragments.add(Values.toObject(OBJECT_MAPPER, element, fragmentType));
            } catch (ConfigParseException e) {
                throw new ConfigParseException("Malformed element %s[%d]".formatted(section, i), e);
            }
        }

        return fragments;
    }

}
