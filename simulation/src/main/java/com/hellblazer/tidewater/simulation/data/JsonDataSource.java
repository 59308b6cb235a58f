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
package com.hellblazer.tidewater.simulation.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.tidewater.simulation.SimulationException.MalformedConfigurationException;
import com.hellblazer.tidewater.simulation.SimulationResults;
import com.hellblazer.tidewater.simulation.config.CustomerSpec;
import com.hellblazer.tidewater.simulation.config.ShipSpec;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Data source backed by a directory of JSON documents:
 * <ul>
 *   <li>{@code ships.json}</li>
 *   <li>{@code customers.json}</li>
 *   <li>{@code distances.json}</li>
 *   <li>{@code simulation_params.json}</li>
 * </ul>
 * Results are written next to them as {@code results_<timestamp>.json}.
 *
 * @author hal.hildebrand
 */
public class JsonDataSource implements SupplyDataSource {
    private static final Logger            log               = LoggerFactory.getLogger(JsonDataSource.class);
    private static final DateTimeFormatter RESULTS_STAMP     = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final int               MAX_NAME_ATTEMPTS = 1000;
    public static final  String            SHIPS_FILE        = "ships.json";
    public static final  String            CUSTOMERS_FILE    = "customers.json";
    public static final  String            DISTANCES_FILE    = "distances.json";
    public static final  String            PARAMS_FILE       = "simulation_params.json";

    private final Path         dataDir;
    private final ObjectMapper objectMapper;

    public JsonDataSource(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = TidewaterJson.newMapper();
    }

    public Path getDataDir() {
        return dataDir;
    }

    @Override
    public List<ShipSpec> getShipsData() {
        return ConfigurationReader.readShips(read(SHIPS_FILE));
    }

    @Override
    public List<CustomerSpec> getCustomersData() {
        return ConfigurationReader.readCustomers(read(CUSTOMERS_FILE));
    }

    @Override
    public DistanceMatrix getDistanceMatrix() {
        return ConfigurationReader.readDistances(read(DISTANCES_FILE));
    }

    @Override
    public Map<String, Object> getSimulationParams() {
        return ConfigurationReader.readParams(read(PARAMS_FILE));
    }

    /**
     * Write the results to a new file. A name already taken within the same millisecond gets a numeric suffix, so no
     * earlier results are overwritten.
     *
     * @throws UncheckedIOException when the results file cannot be written
     */
    @Override
    public void saveResults(SimulationResults results) {
        var stem = "results_" + LocalDateTime.now().format(RESULTS_STAMP);
        var file = dataDir.resolve(stem + ".json");
        for (int attempt = 1; ; attempt++) {
            try (var out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writeValue(out, results);
                break;
            } catch (FileAlreadyExistsException e) {
                if (attempt >= MAX_NAME_ATTEMPTS) {
                    throw new UncheckedIOException("No free results file name for " + stem, e);
                }
                file = dataDir.resolve(stem + "_" + attempt + ".json");
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to write results to " + file, e);
            }
        }
        log.info("Results saved to {}", file);
    }

    private JsonNode read(String fileName) {
        var file = dataDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new MalformedConfigurationException("Missing configuration file " + file);
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new MalformedConfigurationException("Unable to parse " + file + ": " + e.getMessage(), e);
        }
    }
}
