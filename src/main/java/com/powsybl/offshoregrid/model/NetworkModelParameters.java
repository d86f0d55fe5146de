/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.CrossBorderMode;
import com.powsybl.offshoregrid.ModelType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * @author Offshore grid planning developers
 */
public class NetworkModelParameters {

    public static final double HUB_CAPACITY_LIMIT_DEFAULT_VALUE = 2500;

    public static final double SUBSTATION_CAPACITY_FACTOR_DEFAULT_VALUE = 2.5;

    public static final double ZERO_THRESHOLD_DEFAULT_VALUE = 1e-3;

    public static final double SUBSTATION_CAPACITY_WEIGHT_DEFAULT_VALUE = 1.0;

    private ModelType modelType = ModelType.COMBINED;

    private CrossBorderMode crossBorderMode = CrossBorderMode.POOLED;

    private List<Country> countries = new ArrayList<>();

    private double hubCapacityLimit = HUB_CAPACITY_LIMIT_DEFAULT_VALUE;

    private double substationCapacityFactor = SUBSTATION_CAPACITY_FACTOR_DEFAULT_VALUE;

    private double zeroThreshold = ZERO_THRESHOLD_DEFAULT_VALUE;

    private double substationCapacityWeight = SUBSTATION_CAPACITY_WEIGHT_DEFAULT_VALUE;

    public ModelType getModelType() {
        return modelType;
    }

    public NetworkModelParameters setModelType(ModelType modelType) {
        this.modelType = Objects.requireNonNull(modelType);
        return this;
    }

    public CrossBorderMode getCrossBorderMode() {
        return crossBorderMode;
    }

    public NetworkModelParameters setCrossBorderMode(CrossBorderMode crossBorderMode) {
        this.crossBorderMode = Objects.requireNonNull(crossBorderMode);
        return this;
    }

    /**
     * Countries having a capacity target, one allocation variable per wind farm and country.
     */
    public List<Country> getCountries() {
        return countries;
    }

    public NetworkModelParameters setCountries(List<Country> countries) {
        this.countries = new ArrayList<>(Objects.requireNonNull(countries));
        return this;
    }

    public double getHubCapacityLimit() {
        return hubCapacityLimit;
    }

    public NetworkModelParameters setHubCapacityLimit(double hubCapacityLimit) {
        this.hubCapacityLimit = checkNonNegative("hub capacity limit", hubCapacityLimit);
        return this;
    }

    public double getSubstationCapacityFactor() {
        return substationCapacityFactor;
    }

    public NetworkModelParameters setSubstationCapacityFactor(double substationCapacityFactor) {
        this.substationCapacityFactor = checkNonNegative("substation capacity factor", substationCapacityFactor);
        return this;
    }

    public double getZeroThreshold() {
        return zeroThreshold;
    }

    public NetworkModelParameters setZeroThreshold(double zeroThreshold) {
        this.zeroThreshold = checkNonNegative("zero threshold", zeroThreshold);
        return this;
    }

    public double getSubstationCapacityWeight() {
        return substationCapacityWeight;
    }

    public NetworkModelParameters setSubstationCapacityWeight(double substationCapacityWeight) {
        this.substationCapacityWeight = checkNonNegative("substation capacity weight", substationCapacityWeight);
        return this;
    }

    private static double checkNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "NetworkModelParameters("
                + "modelType=" + modelType
                + ", crossBorderMode=" + crossBorderMode
                + ", countries=" + countries
                + ", hubCapacityLimit=" + hubCapacityLimit
                + ", substationCapacityFactor=" + substationCapacityFactor
                + ", zeroThreshold=" + zeroThreshold
                + ", substationCapacityWeight=" + substationCapacityWeight
                + ")";
    }
}
