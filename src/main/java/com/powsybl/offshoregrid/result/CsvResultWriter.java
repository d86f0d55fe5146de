/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.offshoregrid.network.AssetClass;
import com.powsybl.offshoregrid.network.ConnectionType;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Writes one CSV file per asset class and stage, plus a global totals file, named
 * {@code <prefix>_<class>_<year>.csv}.
 *
 * @author Offshore grid planning developers
 */
public class CsvResultWriter implements ResultWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvResultWriter.class);

    private static final String[] CABLE_HEADERS = {"id", "iso", "from_id", "to_id", "from_lon", "from_lat", "to_lon", "to_lat",
        "distance", "capacity", "cost", "cost_sf"};

    private final Path directory;

    private final String filePrefix;

    public CsvResultWriter(Path directory, String filePrefix) {
        this.directory = Objects.requireNonNull(directory);
        this.filePrefix = Objects.requireNonNull(filePrefix);
    }

    public Path getFile(String component, int year) {
        return directory.resolve(filePrefix + "_" + component + "_" + year + ".csv");
    }

    @Override
    public Path getSolverLogFile(int year) {
        createDirectory();
        return directory.resolve(filePrefix + "_solverlog_" + year + ".txt");
    }

    public Path getMetadataFile() {
        return directory.resolve(filePrefix + "_metadata.json");
    }

    private void createDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeCsv(Path file, Consumer<CsvWriter> rowsWriter) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, new CsvWriterSettings());
            rowsWriter.accept(csvWriter);
            csvWriter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void writeStage(StageResult result) {
        Objects.requireNonNull(result);
        createDirectory();
        int year = result.getYear();

        writeCsv(getFile(AssetClass.WIND_FARM.getCode(), year), csv -> {
            csv.writeHeaders("id", "iso", "lon", "lat", "capacity", "cost", "rate", "cost_sf");
            for (WindFarmRecord r : result.getWindFarms()) {
                csv.writeRow(r.id(), r.country().name(), r.longitude(), r.latitude(), r.capacity(), r.cost(), r.rate(), r.referenceCost());
            }
        });
        writeCsv(getFile(AssetClass.ENERGY_HUB.getCode(), year), csv -> {
            csv.writeHeaders("id", "iso", "lon", "lat", "water_depth", "ice_cover", "port_dist", "capacity", "cost", "cost_sf");
            for (EnergyHubRecord r : result.getEnergyHubs()) {
                csv.writeRow(r.id(), r.country().name(), r.longitude(), r.latitude(), r.waterDepth(), r.iceCover() ? 1 : 0,
                        r.portDistance(), r.capacity(), r.cost(), r.referenceCost());
            }
        });
        writeCsv(getFile(AssetClass.ONSHORE_SUBSTATION.getCode(), year), csv -> {
            csv.writeHeaders("id", "iso", "lon", "lat", "threshold", "capacity", "cost", "cost_sf");
            for (SubstationRecord r : result.getSubstations()) {
                csv.writeRow(r.id(), r.country().name(), r.longitude(), r.latitude(), r.capacityThreshold(), r.capacity(),
                        r.cost(), r.referenceCost());
            }
        });
        for (ConnectionType type : ConnectionType.values()) {
            List<CableRecord> cables = result.getCables(type);
            writeCsv(getFile(type.getCode(), year), csv -> {
                csv.writeHeaders(CABLE_HEADERS);
                for (CableRecord r : cables) {
                    csv.writeRow(r.cableId(), r.country().name(), r.fromId(), r.toId(), r.fromLongitude(), r.fromLatitude(),
                            r.toLongitude(), r.toLatitude(), r.distance(), r.capacity(), r.cost(), r.referenceCost());
                }
            });
        }
        writeCsv(getFile("global", year), csv -> {
            csv.writeHeaders("component", "capacity", "cost");
            for (Map.Entry<AssetClass, ClassTotals> e : result.getTotals().entrySet()) {
                csv.writeRow(e.getKey().getCode(), e.getValue().capacity(), e.getValue().cost());
            }
            csv.writeRow("total", result.getTotalCapacity(), result.getTotalCost());
        });
        LOGGER.info("Results of year {} written to {}", year, directory);
    }

    @Override
    public void writeMetadata(RunMetadata metadata) {
        Objects.requireNonNull(metadata);
        createDirectory();
        ObjectMapper objectMapper = JsonUtil.createObjectMapper();
        try (BufferedWriter writer = Files.newBufferedWriter(getMetadataFile(), StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, metadata);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
