/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.network.AssetClass;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Discounting assumptions and per asset class cost sensitivity factors.
 *
 * @author Offshore grid planning developers
 */
public class CostParameters {

    public static final int BASE_YEAR_DEFAULT_VALUE = 2024;

    public static final double DISCOUNT_RATE_DEFAULT_VALUE = 0.05;

    public static final int LIFETIME_DEFAULT_VALUE = 25;

    public static final double SENSITIVITY_FACTOR_DEFAULT_VALUE = 1.0;

    private int baseYear = BASE_YEAR_DEFAULT_VALUE;

    private double discountRate = DISCOUNT_RATE_DEFAULT_VALUE;

    private int lifetime = LIFETIME_DEFAULT_VALUE;

    private final Map<AssetClass, Double> sensitivityFactors = new EnumMap<>(AssetClass.class);

    public int getBaseYear() {
        return baseYear;
    }

    public CostParameters setBaseYear(int baseYear) {
        this.baseYear = baseYear;
        return this;
    }

    public double getDiscountRate() {
        return discountRate;
    }

    public CostParameters setDiscountRate(double discountRate) {
        if (!(discountRate > -1) || Double.isInfinite(discountRate)) {
            throw new IllegalArgumentException("Invalid discount rate: " + discountRate);
        }
        this.discountRate = discountRate;
        return this;
    }

    public int getLifetime() {
        return lifetime;
    }

    public CostParameters setLifetime(int lifetime) {
        if (lifetime < 0) {
            throw new IllegalArgumentException("Invalid lifetime: " + lifetime);
        }
        this.lifetime = lifetime;
        return this;
    }

    public double getSensitivityFactor(AssetClass assetClass) {
        return sensitivityFactors.getOrDefault(Objects.requireNonNull(assetClass), SENSITIVITY_FACTOR_DEFAULT_VALUE);
    }

    public CostParameters setSensitivityFactor(AssetClass assetClass, double factor) {
        Objects.requireNonNull(assetClass);
        if (!(factor >= 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Invalid cost sensitivity factor for " + assetClass + ": " + factor);
        }
        sensitivityFactors.put(assetClass, factor);
        return this;
    }

    public Map<AssetClass, Double> getSensitivityFactors() {
        Map<AssetClass, Double> factors = new EnumMap<>(AssetClass.class);
        for (AssetClass assetClass : AssetClass.values()) {
            factors.put(assetClass, getSensitivityFactor(assetClass));
        }
        return factors;
    }

    @Override
    public String toString() {
        return "CostParameters("
                + "baseYear=" + baseYear
                + ", discountRate=" + discountRate
                + ", lifetime=" + lifetime
                + ", sensitivityFactors=" + getSensitivityFactors()
                + ")";
    }
}
