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

import org.eclipse.microprofile.config.Config;
import org.entrykit.common.config.BootConfigLoader;
import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.config.RuntimeConfigFactory;
import org.entrykit.common.locale.FragmentSelector;
import org.entrykit.common.locale.LocaleMatcher;
import org.entrykit.entry.cert.CertEntryRegistrar;
import org.entrykit.entry.config.ConfigEntryRegistrar;
import org.entrykit.entry.cred.CredEntryRegistrar;
import org.entrykit.secret.management.RetrievalConfig;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Process entry point.
 * <p>
 * Loads the boot configuration, registers the entries of all known sections
 * and bootstraps them. Configuration errors abort startup with exit code {@value #EXIT_CONFIG_ERROR}.
 * <pre>
 * java -jar entrykit.jar [--set key=value[,key=value]]... boot.yaml
 * </pre>
 *
 * @since 1.0.0
 */
public final class Bootstrapper {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(Bootstrapper.class);
    private static final String USAGE = "Usage: entrykit [--set key=value[,key=value]]... <boot.yaml>";

    private final BootstrapConfig bootstrapConfig;
    private final RetrievalConfig retrievalConfig;
    private final Map<String, String> environment;
    private final List<EntryRegistrar> registrars;
    private final EntryRegistry registry = new EntryRegistry();

    Bootstrapper(Config config, LocaleMatcher localeMatcher, Map<String, String> environment) {
        requireNonNull(config, "config must not be null");
        requireNonNull(localeMatcher, "localeMatcher must not be null");
        this.bootstrapConfig = new BootstrapConfig(config);
        this.retrievalConfig = new RetrievalConfig(config);
        this.environment = requireNonNull(environment, "environment must not be null");

        final Path baseDirectory = bootstrapConfig.getBaseDirectory();
        final var fragmentSelector = new FragmentSelector(localeMatcher);
        final var settingsFactory = new ProviderSettingsFactory(baseDirectory);
        this.registrars = List.of(
                new ConfigEntryRegistrar(fragmentSelector, baseDirectory),
                new CredEntryRegistrar(fragmentSelector, settingsFactory),
                new CertEntryRegistrar(localeMatcher, settingsFactory));
    }

    public static Bootstrapper create(Config config) {
        return new Bootstrapper(config, LocaleMatcher.systemEnvironment(), System.getenv());
    }

    public EntryRegistry registry() {
        return registry;
    }

    /**
     * Load the boot configuration and register the entries it declares.
     *
     * @param bootFile      The boot configuration file.
     * @param flagOverrides Overrides in {@code key=value[,key=value]} syntax, applied last.
     * @throws ConfigParseException When the boot configuration or one of its sections is malformed.
     */
    public void register(Path bootFile, List<String> flagOverrides) throws ConfigParseException {
        final var loader = new BootConfigLoader(environment, bootstrapConfig.getEnvOverridePrefix());
        final MappingValue boot = loader.load(bootFile, flagOverrides);

        for (final EntryRegistrar registrar : registrars) {
            try {
                registrar.register(boot).forEach(registry::add);
            } catch (ConfigParseException e) {
                throw new ConfigParseException(
                        "Failed to register entries of section %s".formatted(registrar.section()), e);
            }
        }
    }

    public void bootstrap() {
        final Instant deadline = bootstrapConfig.getDeadline()
                .map(timeout -> Instant.now().plus(timeout))
                .orElse(null);
        registry.bootstrapAll(createContext(deadline));
    }

    public void interrupt() {
        registry.interruptAll(createContext(null));
    }

    /**
     * @param args Command line arguments.
     * @return The process exit code.
     */
    public int run(String[] args) {
        requireNonNull(args, "args must not be null");

        final var flagOverrides = new ArrayList<String>();
        Path bootFile = null;
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if ("--set".equals(arg)) {
                if (i + 1 >= args.length) {
                    LOGGER.error("Missing value for --set; {}", USAGE);
                    return EXIT_USAGE_ERROR;
                }
                flagOverrides.add(args[++i]);
            } else if (arg.startsWith("--set=")) {
                flagOverrides.add(arg.substring("--set=".length()));
            } else if (arg.startsWith("-")) {
                LOGGER.error("Unknown option {}; {}", arg, USAGE);
                return EXIT_USAGE_ERROR;
            } else if (bootFile == null) {
                bootFile = Path.of(arg);
            } else {
                LOGGER.error("Only one boot config file may be provided, but got {} and {}; {}", bootFile, arg, USAGE);
                return EXIT_USAGE_ERROR;
            }
        }

        if (bootFile == null) {
            LOGGER.error("No boot config file provided; {}", USAGE);
            return EXIT_USAGE_ERROR;
        }

        try {
            register(bootFile, flagOverrides);
        } catch (ConfigParseException e) {
            LOGGER.error("Failed to load boot config {}", bootFile, e);
            return EXIT_CONFIG_ERROR;
        }

        bootstrap();
        LOGGER.info("Bootstrapped {} entries", registry.getAll().size());
        return EXIT_OK;
    }

    private BootstrapContext createContext(@Nullable Instant deadline) {
        return new BootstrapContext(RetrieveContext.of(retrievalConfig, deadline));
    }

    public static void main(final String[] args) {
        final Bootstrapper bootstrapper = create(RuntimeConfigFactory.create());
        addShutdownHook(bootstrapper);

        final int exitCode = bootstrapper.run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    private static void addShutdownHook(final Bootstrapper bootstrapper) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Interrupting entries");
            bootstrapper.interrupt();
        }, "entrykit-shutdown-hook"));
    }

}
