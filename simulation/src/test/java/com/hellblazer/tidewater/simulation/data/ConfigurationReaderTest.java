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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigurationReader - field mapping and error reporting on malformed documents.
 *
 * @author hal.hildebrand
 */
class ConfigurationReaderTest {

    private final ObjectMapper mapper = TidewaterJson.newMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Test
    void testReadShips() throws Exception {
        var ships = ConfigurationReader.readShips(json(
        "[{'id':'s1','name':'One','capacity':1000,'speed':20.5,'initial_location':'port_main','initial_cargo':400},"
        + "{'id':'s2','name':'Two','capacity':500,'speed':10,'initial_location':'a'}]"));

        assertEquals(2, ships.size());
        var first = ships.get(0);
        assertEquals("s1", first.id());
        assertEquals(1000.0, first.capacity());
        assertEquals(20.5, first.speed());
        assertEquals("port_main", first.initialLocation());
        assertEquals(400.0, first.initialCargo());
        assertEquals(0.0, ships.get(1).initialCargo(), "initial cargo defaults to empty");
    }

    @Test
    void testMissingFieldNamesShipAndField() throws Exception {
        var document = json("[{'id':'s7','name':'Seven','capacity':1000,'initial_location':'port_main'}]");

        var e = assertThrows(MalformedConfigurationException.class, () -> ConfigurationReader.readShips(document));

        assertEquals("ship s7: missing required field 'speed'", e.getMessage());
    }

    @Test
    void testWrongTypeRejected() throws Exception {
        var document = json(
        "[{'id':'c1','name':'C','location':'a','demand_rate':'lots','initial_inventory':1,'min_inventory':0,"
        + "'max_inventory':10}]");

        var e = assertThrows(MalformedConfigurationException.class,
                             () -> ConfigurationReader.readCustomers(document));

        assertTrue(e.getMessage().contains("c1") && e.getMessage().contains("demand_rate"), e.getMessage());
    }

    @Test
    void testReadCustomers() throws Exception {
        var customers = ConfigurationReader.readCustomers(json(
        "[{'id':'c1','name':'C','location':'a','demand_rate':100,'initial_inventory':2400,'min_inventory':0,"
        + "'max_inventory':6000}]"));

        var customer = customers.get(0);
        assertEquals("a", customer.location());
        assertEquals(100.0, customer.demandRate());
        assertEquals(2400.0, customer.initialInventory());
        assertEquals(6000.0, customer.maxInventory());
    }

    @Test
    void testReadDistances() throws Exception {
        var matrix = ConfigurationReader.readDistances(json("{'port_main':{'a':450,'port_main':0},'a':{}}"));

        assertEquals(450.0, matrix.distance("port_main", "a"));
        assertFalse(matrix.hasRoute("a", "port_main"));
        assertThrows(MalformedConfigurationException.class,
                     () -> ConfigurationReader.readDistances(json("{'port_main':{'a':'far'}}")));
        assertThrows(MalformedConfigurationException.class,
                     () -> ConfigurationReader.readDistances(json("[1, 2]")));
    }

    @Test
    void testReadParams() throws Exception {
        var params = ConfigurationReader.readParams(
        json("{'simulation_duration':720.0,'time_step':1,'random_seed':42,'port_location':'harbor'}"));

        assertEquals(720.0, ((Number) params.get("simulation_duration")).doubleValue());
        assertEquals(42, ((Number) params.get("random_seed")).intValue());
        assertEquals("harbor", params.get("port_location"));
        assertThrows(MalformedConfigurationException.class,
                     () -> ConfigurationReader.readParams(json("{'time_step':[1]}")));
    }

    @Test
    void testReadParamsKeepsExtraEntries() throws Exception {
        var params = ConfigurationReader.readParams(
        json("{'simulation_duration':24,'time_step':1,'scenario':'north_sea','notes':{'author':'ops'}}"));

        assertEquals("north_sea", params.get("scenario"));
        assertFalse(params.containsKey("notes"));
    }

    @Test
    void testNonArrayRejected() throws Exception {
        var document = json("{'id':'s1'}");
        assertThrows(MalformedConfigurationException.class, () -> ConfigurationReader.readShips(document));
    }
}
