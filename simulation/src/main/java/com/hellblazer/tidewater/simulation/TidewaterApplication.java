/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tidewater Simulation Framework.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program.  If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tidewater.simulation;

import com.hellblazer.tidewater.simulation.data.JsonDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 * tidewater [dataDir] [--param name=value]... [--study name=v1,v2,...]
 * </pre>
 * Without {@code --study} a single run is made and its summary logged. With it, one run per value is made and the
 * metrics of each logged side by side; {@code --param} overrides then apply to every run.
 *
 * @author hal.hildebrand
 */
public class TidewaterApplication {
    private static final Logger log = LoggerFactory.getLogger(TidewaterApplication.class);

    public static final String DEFAULT_DATA_DIR = "data";

    /**
     * Parsed command-line options.
     */
    public static class Config {
        public Path                dataDir     = Path.of(DEFAULT_DATA_DIR);
        public Map<String, Object> overrides   = new LinkedHashMap<>();
        public String              studyParam;
        public List<Object>        studyValues = new ArrayList<>();
        public boolean             help;
        public List<String>        errors      = new ArrayList<>();

        public boolean isStudy() {
            return studyParam != null;
        }

        @Override
        public String toString() {
            return String.format("Config{dataDir=%s, overrides=%s, study=%s%s}", dataDir, overrides, studyParam,
                                 studyValues);
        }
    }

    public static Config parse(String[] args) {
        var config = new Config();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-h", "--help" -> config.help = true;
                case "-p", "--param" -> {
                    if (i + 1 < args.length) {
                        var pair = split(args[++i], config);
                        if (pair != null) {
                            config.overrides.put(pair[0], convert(pair[1]));
                        }
                    } else {
                        config.errors.add(arg + " requires name=value");
                    }
                }
                case "-s", "--study" -> {
                    if (i + 1 < args.length) {
                        var pair = split(args[++i], config);
                        if (pair != null) {
                            config.studyParam = pair[0];
                            config.studyValues.clear();
                            for (var value : pair[1].split(",")) {
                                if (!value.isBlank()) {
                                    config.studyValues.add(convert(value.trim()));
                                }
                            }
                            if (config.studyValues.isEmpty()) {
                                config.errors.add("Study of " + pair[0] + " has no values");
                            }
                        }
                    } else {
                        config.errors.add(arg + " requires name=v1,v2,...");
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        config.errors.add("Unknown option: " + arg);
                    } else {
                        config.dataDir = Path.of(arg);
                    }
                }
            }
        }
        if (!config.help && !Files.isDirectory(config.dataDir)) {
            config.errors.add("Data directory does not exist: " + config.dataDir);
        }
        return config;
    }

    private static String[] split(String pair, Config config) {
        var eq = pair.indexOf('=');
        if (eq <= 0 || eq == pair.length() - 1) {
            config.errors.add("Expected name=value, got: " + pair);
            return null;
        }
        return new String[] { pair.substring(0, eq).trim(), pair.substring(eq + 1).trim() };
    }

    /**
     * Numeric values become doubles, anything else stays a string.
     */
    static Object convert(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    public static void printUsage(PrintStream out) {
        out.println("Tidewater - Maritime Resupply Simulation");
        out.println();
        out.println("Usage: tidewater [dataDir] [options]");
        out.println();
        out.println("  dataDir                     Directory holding ships.json, customers.json, distances.json");
        out.println("                              and simulation_params.json (default: " + DEFAULT_DATA_DIR + ")");
        out.println("  -p, --param <name=value>    Override a simulation parameter, repeatable");
        out.println("  -s, --study <name=v1,v2>    Run once per value of the named parameter");
        out.println("  -h, --help                  Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  tidewater data --param loading_rate=8000");
        out.println("  tidewater data --study resupply_threshold_days=2,3,5");
    }

    /**
     * @return the process exit code
     */
    public static int run(Config config, PrintStream out) {
        if (config.help) {
            printUsage(out);
            return 0;
        }
        if (!config.errors.isEmpty()) {
            out.println("Configuration errors:");
            config.errors.forEach(error -> out.println("  - " + error));
            out.println();
            out.println("Use 'tidewater --help' for usage information.");
            return 1;
        }
        log.info("Configuration: {}", config);
        var dataSource = new JsonDataSource(config.dataDir);
        try {
            if (config.isStudy()) {
                var results = new ParameterStudy(dataSource, config.overrides, config.studyParam,
                                                 config.studyValues).run();
                for (var result : results) {
                    var metrics = result.metrics();
                    log.info("{} = {}: service level {}, stockout events {}", result.paramName(),
                             result.paramValue(), String.format("%.4f", metrics.overallServiceLevel()),
                             metrics.totalStockoutEvents());
                }
            } else {
                var simulation = new SupplySimulation(dataSource, config.overrides);
                var results = simulation.run();
                summarize(simulation.getContext(), results);
            }
        } catch (SimulationException e) {
            log.error("Simulation failed: {}", e.getMessage());
            return 2;
        }
        return 0;
    }

    private static void summarize(SimulationContext context, SimulationResults results) {
        var metrics = results.metrics();
        log.info("Overall service level: {}", String.format("%.4f", metrics.overallServiceLevel()));
        log.info("Total stockout events: {}", metrics.totalStockoutEvents());
        log.info("Event counts: {}", results.metadata().eventCounts());
        metrics.customerMetrics()
               .forEach((id, m) -> log.info("Customer {}: avg inventory {}, min {}, stockout hours {}, service {}",
                                            id, String.format("%.1f", m.avgInventory()),
                                            String.format("%.1f", m.minInventory()), m.stockoutHours(),
                                            String.format("%.4f", m.serviceLevel())));
        metrics.shipMetrics()
               .forEach((id, m) -> log.info("Ship {}: distance {}, deliveries {}, resupplies {}", id,
                                            String.format("%.1f", m.totalDistance()), m.numDeliveries(),
                                            m.numResupplies()));
        context.ships().forEach(ship -> log.info("Final ship status: {}", ship.status()));
        context.customers().forEach(customer -> log.info("Final customer status: {}", customer.status()));
    }

    public static void main(String[] args) {
        System.exit(run(parse(args), System.out));
    }
}
