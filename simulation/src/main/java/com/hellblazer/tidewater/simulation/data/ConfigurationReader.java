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
import com.hellblazer.tidewater.simulation.SimulationException.MalformedConfigurationException;
import com.hellblazer.tidewater.simulation.config.CustomerSpec;
import com.hellblazer.tidewater.simulation.config.ShipSpec;
import com.hellblazer.tidewater.simulation.config.SimulationParams;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps configuration documents onto the typed configuration records, naming the offending entity and field on
 * every error.
 * <p>
 * Document shapes:
 * <pre>
 * ships:      [{"id", "name", "capacity", "speed", "initial_location", "initial_cargo"?}, ...]
 * customers:  [{"id", "name", "location", "demand_rate", "initial_inventory", "min_inventory", "max_inventory"}, ...]
 * distances:  {"from": {"to": distance, ...}, ...}
 * parameters: {"simulation_duration": 720.0, "time_step": 1.0, ...}
 * </pre>
 * Extra parameter entries are passed through when scalar and dropped otherwise.
 *
 * @author hal.hildebrand
 */
public final class ConfigurationReader {

    private ConfigurationReader() {
    }

    public static List<ShipSpec> readShips(JsonNode document) {
        var ships = new ArrayList<ShipSpec>();
        for (var node : array(document, "ships")) {
            var id = text(node, "id", "ship", null);
            ships.add(new ShipSpec(id, text(node, "name", "ship", id), number(node, "capacity", "ship", id),
                                   number(node, "speed", "ship", id), text(node, "initial_location", "ship", id),
                                   node.hasNonNull("initial_cargo") ? number(node, "initial_cargo", "ship", id)
                                                                    : 0.0));
        }
        return ships;
    }

    public static List<CustomerSpec> readCustomers(JsonNode document) {
        var customers = new ArrayList<CustomerSpec>();
        for (var node : array(document, "customers")) {
            var id = text(node, "id", "customer", null);
            customers.add(new CustomerSpec(id, text(node, "name", "customer", id),
                                           text(node, "location", "customer", id),
                                           number(node, "demand_rate", "customer", id),
                                           number(node, "initial_inventory", "customer", id),
                                           number(node, "min_inventory", "customer", id),
                                           number(node, "max_inventory", "customer", id)));
        }
        return customers;
    }

    public static DistanceMatrix readDistances(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new MalformedConfigurationException("distances: expected an object of objects");
        }
        var matrix = new LinkedHashMap<String, Map<String, Double>>();
        var rows = document.fields();
        while (rows.hasNext()) {
            var row = rows.next();
            if (!row.getValue().isObject()) {
                throw new MalformedConfigurationException("distances." + row.getKey() + ": expected an object");
            }
            var targets = new LinkedHashMap<String, Double>();
            var cells = row.getValue().fields();
            while (cells.hasNext()) {
                var cell = cells.next();
                if (!cell.getValue().isNumber()) {
                    throw new MalformedConfigurationException(
                    "distances." + row.getKey() + "." + cell.getKey() + ": expected a number");
                }
                targets.put(cell.getKey(), cell.getValue().doubleValue());
            }
            matrix.put(row.getKey(), targets);
        }
        return DistanceMatrix.of(matrix);
    }

    /**
     * @return numbers and strings by parameter name, in document order
     */
    public static Map<String, Object> readParams(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new MalformedConfigurationException("simulation_params: expected an object");
        }
        var params = new LinkedHashMap<String, Object>();
        var fields = document.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var value = field.getValue();
            if (value.isNumber()) {
                params.put(field.getKey(), value.numberValue());
            } else if (value.isTextual()) {
                params.put(field.getKey(), value.textValue());
            } else if (!value.isNull() && SimulationParams.NAMES.contains(field.getKey())) {
                throw new MalformedConfigurationException(
                "simulation_params." + field.getKey() + ": expected a number or a string");
            }
        }
        return params;
    }

    private static Iterable<JsonNode> array(JsonNode document, String what) {
        if (document == null || !document.isArray()) {
            throw new MalformedConfigurationException(what + ": expected an array");
        }
        return document;
    }

    private static String text(JsonNode node, String field, String entity, String id) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw missing(field, entity, id);
        }
        if (!value.isValueNode()) {
            throw new MalformedConfigurationException(
            String.format("%s %s: field '%s' must be a string", entity, label(id), field));
        }
        return value.asText();
    }

    private static double number(JsonNode node, String field, String entity, String id) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw missing(field, entity, id);
        }
        if (!value.isNumber()) {
            throw new MalformedConfigurationException(
            String.format("%s %s: field '%s' must be a number", entity, label(id), field));
        }
        return value.doubleValue();
    }

    private static MalformedConfigurationException missing(String field, String entity, String id) {
        return new MalformedConfigurationException(
        String.format("%s %s: missing required field '%s'", entity, label(id), field));
    }

    private static String label(String id) {
        return id == null ? "<unknown>" : id;
    }
}
