/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.cost.CostParameters;
import com.powsybl.offshoregrid.geo.ConnectionThresholds;
import com.powsybl.offshoregrid.model.NetworkModelParameters;
import com.powsybl.offshoregrid.model.StageParameters;
import com.powsybl.offshoregrid.network.AssetClass;
import com.powsybl.offshoregrid.network.ConnectionType;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Parameters of a planning run.
 *
 * @author Offshore grid planning developers
 */
public class OffshoreGridParameters {

    public static final String MODULE_NAME = "offshore-grid-default-parameters";

    public static final String MODEL_TYPE_PARAM_NAME = "modelType";
    public static final String CROSS_BORDER_MODE_PARAM_NAME = "crossBorderMode";
    public static final String PLANNING_MODE_PARAM_NAME = "planningMode";
    public static final String CABLE_COUNT_MODE_PARAM_NAME = "cableCountMode";
    public static final String STAGE_FAILURE_POLICY_PARAM_NAME = "stageFailurePolicy";
    public static final String SOLVER_NAME_PARAM_NAME = "solverName";
    public static final String ZERO_THRESHOLD_PARAM_NAME = "zeroThreshold";
    public static final String TURBINE_CAPACITY_PARAM_NAME = "turbineCapacity";
    public static final String HUB_CAPACITY_LIMIT_PARAM_NAME = "hubCapacityLimit";
    public static final String SUBSTATION_CAPACITY_FACTOR_PARAM_NAME = "substationCapacityFactor";
    public static final String SUBSTATION_CAPACITY_WEIGHT_PARAM_NAME = "substationCapacityWeight";
    public static final String WF_EH_MAX_DISTANCE_PARAM_NAME = "wfEhMaxDistance";
    public static final String EH_ONSS_MAX_DISTANCE_PARAM_NAME = "ehOnssMaxDistance";
    public static final String WF_ONSS_MAX_DISTANCE_PARAM_NAME = "wfOnssMaxDistance";
    public static final String ONSS_ONSS_MAX_DISTANCE_PARAM_NAME = "onssOnssMaxDistance";
    public static final String SINGLE_YEAR_PARAM_NAME = "singleYear";
    public static final String MULTI_YEARS_PARAM_NAME = "multiYears";
    public static final String DEVELOPMENT_FRACTIONS_PARAM_NAME = "developmentFractions";
    public static final String COUNTRY_CAPACITY_FRACTIONS_PARAM_NAME = "countryCapacityFractions";
    public static final String BASE_YEAR_PARAM_NAME = "baseYear";
    public static final String DISCOUNT_RATE_PARAM_NAME = "discountRate";
    public static final String LIFETIME_PARAM_NAME = "lifetime";
    public static final String COST_SENSITIVITY_FACTORS_PARAM_NAME = "costSensitivityFactors";

    public static final ModelType MODEL_TYPE_DEFAULT_VALUE = ModelType.POINT_TO_POINT;
    public static final CrossBorderMode CROSS_BORDER_MODE_DEFAULT_VALUE = CrossBorderMode.POOLED;
    public static final PlanningMode PLANNING_MODE_DEFAULT_VALUE = PlanningMode.SINGLE_YEAR;
    public static final CableCountMode CABLE_COUNT_MODE_DEFAULT_VALUE = CableCountMode.DISCRETE;
    public static final StageFailurePolicy STAGE_FAILURE_POLICY_DEFAULT_VALUE = StageFailurePolicy.HALT;
    public static final String SOLVER_NAME_DEFAULT_VALUE = "ojalgo";
    public static final double TURBINE_CAPACITY_DEFAULT_VALUE = 15;
    public static final int SINGLE_YEAR_DEFAULT_VALUE = 2040;
    public static final List<Integer> MULTI_YEARS_DEFAULT_VALUE = List.of(2030, 2040, 2050);
    public static final List<Double> DEVELOPMENT_FRACTIONS_DEFAULT_VALUE = List.of(0.3056, 0.7115, 1.0);
    public static final Map<Country, Double> COUNTRY_CAPACITY_FRACTIONS_DEFAULT_VALUE = createDefaultCountryCapacityFractions();

    private static Map<Country, Double> createDefaultCountryCapacityFractions() {
        Map<Country, Double> fractions = new EnumMap<>(Country.class);
        fractions.put(Country.DE, 1.0);
        fractions.put(Country.DK, 0.0563);
        fractions.put(Country.EE, 0.1219);
        fractions.put(Country.FI, 0.0792);
        fractions.put(Country.LV, 0.0509);
        fractions.put(Country.LT, 0.0282);
        fractions.put(Country.PL, 1.0);
        fractions.put(Country.SE, 0.0201);
        return Collections.unmodifiableMap(fractions);
    }

    private ModelType modelType = MODEL_TYPE_DEFAULT_VALUE;

    private CrossBorderMode crossBorderMode = CROSS_BORDER_MODE_DEFAULT_VALUE;

    private PlanningMode planningMode = PLANNING_MODE_DEFAULT_VALUE;

    private CableCountMode cableCountMode = CABLE_COUNT_MODE_DEFAULT_VALUE;

    private StageFailurePolicy stageFailurePolicy = STAGE_FAILURE_POLICY_DEFAULT_VALUE;

    private String solverName = SOLVER_NAME_DEFAULT_VALUE;

    private double zeroThreshold = NetworkModelParameters.ZERO_THRESHOLD_DEFAULT_VALUE;

    private double turbineCapacity = TURBINE_CAPACITY_DEFAULT_VALUE;

    private double hubCapacityLimit = NetworkModelParameters.HUB_CAPACITY_LIMIT_DEFAULT_VALUE;

    private double substationCapacityFactor = NetworkModelParameters.SUBSTATION_CAPACITY_FACTOR_DEFAULT_VALUE;

    private double substationCapacityWeight = NetworkModelParameters.SUBSTATION_CAPACITY_WEIGHT_DEFAULT_VALUE;

    private final ConnectionThresholds connectionThresholds = new ConnectionThresholds();

    private int singleYear = SINGLE_YEAR_DEFAULT_VALUE;

    private List<Integer> multiYears = MULTI_YEARS_DEFAULT_VALUE;

    private List<Double> developmentFractions = DEVELOPMENT_FRACTIONS_DEFAULT_VALUE;

    private Map<Country, Double> countryCapacityFractions = COUNTRY_CAPACITY_FRACTIONS_DEFAULT_VALUE;

    private final CostParameters costParameters = new CostParameters();

    public ModelType getModelType() {
        return modelType;
    }

    public OffshoreGridParameters setModelType(ModelType modelType) {
        this.modelType = Objects.requireNonNull(modelType);
        return this;
    }

    public CrossBorderMode getCrossBorderMode() {
        return crossBorderMode;
    }

    public OffshoreGridParameters setCrossBorderMode(CrossBorderMode crossBorderMode) {
        this.crossBorderMode = Objects.requireNonNull(crossBorderMode);
        return this;
    }

    public PlanningMode getPlanningMode() {
        return planningMode;
    }

    public OffshoreGridParameters setPlanningMode(PlanningMode planningMode) {
        this.planningMode = Objects.requireNonNull(planningMode);
        return this;
    }

    public CableCountMode getCableCountMode() {
        return cableCountMode;
    }

    public OffshoreGridParameters setCableCountMode(CableCountMode cableCountMode) {
        this.cableCountMode = Objects.requireNonNull(cableCountMode);
        return this;
    }

    public StageFailurePolicy getStageFailurePolicy() {
        return stageFailurePolicy;
    }

    public OffshoreGridParameters setStageFailurePolicy(StageFailurePolicy stageFailurePolicy) {
        this.stageFailurePolicy = Objects.requireNonNull(stageFailurePolicy);
        return this;
    }

    public String getSolverName() {
        return solverName;
    }

    public OffshoreGridParameters setSolverName(String solverName) {
        this.solverName = Objects.requireNonNull(solverName);
        return this;
    }

    public double getZeroThreshold() {
        return zeroThreshold;
    }

    public OffshoreGridParameters setZeroThreshold(double zeroThreshold) {
        this.zeroThreshold = checkNonNegative(ZERO_THRESHOLD_PARAM_NAME, zeroThreshold);
        return this;
    }

    /**
     * Unit wind turbine capacity in MW.
     */
    public double getTurbineCapacity() {
        return turbineCapacity;
    }

    public OffshoreGridParameters setTurbineCapacity(double turbineCapacity) {
        if (!(turbineCapacity > 0)) {
            throw new IllegalArgumentException("Invalid value for parameter " + TURBINE_CAPACITY_PARAM_NAME + ": " + turbineCapacity);
        }
        this.turbineCapacity = turbineCapacity;
        return this;
    }

    public double getHubCapacityLimit() {
        return hubCapacityLimit;
    }

    public OffshoreGridParameters setHubCapacityLimit(double hubCapacityLimit) {
        this.hubCapacityLimit = checkNonNegative(HUB_CAPACITY_LIMIT_PARAM_NAME, hubCapacityLimit);
        return this;
    }

    public double getSubstationCapacityFactor() {
        return substationCapacityFactor;
    }

    public OffshoreGridParameters setSubstationCapacityFactor(double substationCapacityFactor) {
        this.substationCapacityFactor = checkNonNegative(SUBSTATION_CAPACITY_FACTOR_PARAM_NAME, substationCapacityFactor);
        return this;
    }

    public double getSubstationCapacityWeight() {
        return substationCapacityWeight;
    }

    public OffshoreGridParameters setSubstationCapacityWeight(double substationCapacityWeight) {
        this.substationCapacityWeight = checkNonNegative(SUBSTATION_CAPACITY_WEIGHT_PARAM_NAME, substationCapacityWeight);
        return this;
    }

    public ConnectionThresholds getConnectionThresholds() {
        return connectionThresholds;
    }

    public OffshoreGridParameters setMaxDistance(ConnectionType type, double maxDistance) {
        connectionThresholds.set(type, maxDistance);
        return this;
    }

    /**
     * Year of the single stage run, also the reference year of the reported reference costs.
     */
    public int getSingleYear() {
        return singleYear;
    }

    public OffshoreGridParameters setSingleYear(int singleYear) {
        this.singleYear = singleYear;
        return this;
    }

    public List<Integer> getMultiYears() {
        return multiYears;
    }

    public OffshoreGridParameters setMultiYears(List<Integer> multiYears) {
        Objects.requireNonNull(multiYears);
        for (int i = 1; i < multiYears.size(); i++) {
            if (multiYears.get(i) <= multiYears.get(i - 1)) {
                throw new IllegalArgumentException("Stage years must be strictly increasing: " + multiYears);
            }
        }
        this.multiYears = List.copyOf(multiYears);
        return this;
    }

    /**
     * Share of the country targets to reach at each stage of a multi year run.
     */
    public List<Double> getDevelopmentFractions() {
        return developmentFractions;
    }

    public OffshoreGridParameters setDevelopmentFractions(List<Double> developmentFractions) {
        Objects.requireNonNull(developmentFractions);
        for (Double fraction : developmentFractions) {
            if (fraction == null || !(fraction >= 0 && fraction <= 1)) {
                throw new IllegalArgumentException("Invalid development fraction: " + fraction);
            }
        }
        this.developmentFractions = List.copyOf(developmentFractions);
        return this;
    }

    /**
     * Share of the rated capacity of each country wind farms to connect. Countries not listed have no target and
     * receive no allocation.
     */
    public Map<Country, Double> getCountryCapacityFractions() {
        return countryCapacityFractions;
    }

    public OffshoreGridParameters setCountryCapacityFractions(Map<Country, Double> countryCapacityFractions) {
        Objects.requireNonNull(countryCapacityFractions);
        Map<Country, Double> fractions = new EnumMap<>(Country.class);
        countryCapacityFractions.forEach((country, fraction) -> {
            if (fraction == null || !(fraction >= 0 && fraction <= 1)) {
                throw new IllegalArgumentException("Invalid capacity fraction for " + country + ": " + fraction);
            }
            fractions.put(Objects.requireNonNull(country), fraction);
        });
        this.countryCapacityFractions = Collections.unmodifiableMap(fractions);
        return this;
    }

    public CostParameters getCostParameters() {
        return costParameters;
    }

    private static double checkNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Invalid value for parameter " + name + ": " + value);
        }
        return value;
    }

    /**
     * The stages of the run: the single year with the base targets, or each multi year with the base targets scaled
     * by the development fraction.
     */
    public List<StageParameters> createStages() {
        if (planningMode == PlanningMode.SINGLE_YEAR) {
            return List.of(new StageParameters(singleYear, countryCapacityFractions));
        }
        if (multiYears.size() != developmentFractions.size()) {
            throw new IllegalArgumentException("Expected one development fraction per stage year, got "
                    + developmentFractions.size() + " for " + multiYears.size() + " years");
        }
        List<StageParameters> stages = new ArrayList<>(multiYears.size());
        for (int i = 0; i < multiYears.size(); i++) {
            double developmentFraction = developmentFractions.get(i);
            Map<Country, Double> fractions = new EnumMap<>(Country.class);
            countryCapacityFractions.forEach((country, fraction) -> fractions.put(country, fraction * developmentFraction));
            stages.add(new StageParameters(multiYears.get(i), fractions));
        }
        return stages;
    }

    /**
     * Years for which wind farm costs are needed: stage years and reference year.
     */
    public SortedSet<Integer> getCostYears() {
        SortedSet<Integer> years = new TreeSet<>();
        years.add(singleYear);
        if (planningMode == PlanningMode.MULTI_YEAR) {
            years.addAll(multiYears);
        }
        return years;
    }

    public NetworkModelParameters createNetworkModelParameters() {
        return new NetworkModelParameters()
                .setModelType(modelType)
                .setCrossBorderMode(crossBorderMode)
                .setCountries(new ArrayList<>(countryCapacityFractions.keySet()))
                .setHubCapacityLimit(hubCapacityLimit)
                .setSubstationCapacityFactor(substationCapacityFactor)
                .setZeroThreshold(zeroThreshold)
                .setSubstationCapacityWeight(substationCapacityWeight);
    }

    /**
     * Prefix of the result files, for instance {@code r_sf_d_in}.
     */
    public String getFilePrefix() {
        return "r_" + planningMode.getCode() + "_" + modelType.getCode() + "_" + crossBorderMode.getCode();
    }

    public String getNote() {
        return "This result contains modelType=" + modelType
                + ", crossBorderMode=" + crossBorderMode
                + ", planningMode=" + planningMode
                + ", cableCountMode=" + cableCountMode;
    }

    public static OffshoreGridParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OffshoreGridParameters load(PlatformConfig platformConfig) {
        OffshoreGridParameters parameters = new OffshoreGridParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> {
                parameters
                    .setModelType(config.getEnumProperty(MODEL_TYPE_PARAM_NAME, ModelType.class, MODEL_TYPE_DEFAULT_VALUE))
                    .setCrossBorderMode(config.getEnumProperty(CROSS_BORDER_MODE_PARAM_NAME, CrossBorderMode.class, CROSS_BORDER_MODE_DEFAULT_VALUE))
                    .setPlanningMode(config.getEnumProperty(PLANNING_MODE_PARAM_NAME, PlanningMode.class, PLANNING_MODE_DEFAULT_VALUE))
                    .setCableCountMode(config.getEnumProperty(CABLE_COUNT_MODE_PARAM_NAME, CableCountMode.class, CABLE_COUNT_MODE_DEFAULT_VALUE))
                    .setStageFailurePolicy(config.getEnumProperty(STAGE_FAILURE_POLICY_PARAM_NAME, StageFailurePolicy.class, STAGE_FAILURE_POLICY_DEFAULT_VALUE))
                    .setSolverName(config.getStringProperty(SOLVER_NAME_PARAM_NAME, SOLVER_NAME_DEFAULT_VALUE))
                    .setZeroThreshold(config.getDoubleProperty(ZERO_THRESHOLD_PARAM_NAME, NetworkModelParameters.ZERO_THRESHOLD_DEFAULT_VALUE))
                    .setTurbineCapacity(config.getDoubleProperty(TURBINE_CAPACITY_PARAM_NAME, TURBINE_CAPACITY_DEFAULT_VALUE))
                    .setHubCapacityLimit(config.getDoubleProperty(HUB_CAPACITY_LIMIT_PARAM_NAME, NetworkModelParameters.HUB_CAPACITY_LIMIT_DEFAULT_VALUE))
                    .setSubstationCapacityFactor(config.getDoubleProperty(SUBSTATION_CAPACITY_FACTOR_PARAM_NAME, NetworkModelParameters.SUBSTATION_CAPACITY_FACTOR_DEFAULT_VALUE))
                    .setSubstationCapacityWeight(config.getDoubleProperty(SUBSTATION_CAPACITY_WEIGHT_PARAM_NAME, NetworkModelParameters.SUBSTATION_CAPACITY_WEIGHT_DEFAULT_VALUE))
                    .setMaxDistance(ConnectionType.WF_EH, config.getDoubleProperty(WF_EH_MAX_DISTANCE_PARAM_NAME, ConnectionThresholds.WF_EH_DEFAULT_VALUE))
                    .setMaxDistance(ConnectionType.EH_ONSS, config.getDoubleProperty(EH_ONSS_MAX_DISTANCE_PARAM_NAME, ConnectionThresholds.EH_ONSS_DEFAULT_VALUE))
                    .setMaxDistance(ConnectionType.WF_ONSS, config.getDoubleProperty(WF_ONSS_MAX_DISTANCE_PARAM_NAME, ConnectionThresholds.WF_ONSS_DEFAULT_VALUE))
                    .setMaxDistance(ConnectionType.ONSS_ONSS, config.getDoubleProperty(ONSS_ONSS_MAX_DISTANCE_PARAM_NAME, ConnectionThresholds.ONSS_ONSS_DEFAULT_VALUE))
                    .setSingleYear(config.getIntProperty(SINGLE_YEAR_PARAM_NAME, SINGLE_YEAR_DEFAULT_VALUE));
                config.getOptionalStringListProperty(MULTI_YEARS_PARAM_NAME)
                    .ifPresent(prop -> parameters.setMultiYears(parseIntegers(prop)));
                config.getOptionalStringListProperty(DEVELOPMENT_FRACTIONS_PARAM_NAME)
                    .ifPresent(prop -> parameters.setDevelopmentFractions(parseDoubles(prop)));
                config.getOptionalStringListProperty(COUNTRY_CAPACITY_FRACTIONS_PARAM_NAME)
                    .ifPresent(prop -> parameters.setCountryCapacityFractions(parseCountryFractions(prop)));
                parameters.getCostParameters()
                    .setBaseYear(config.getIntProperty(BASE_YEAR_PARAM_NAME, CostParameters.BASE_YEAR_DEFAULT_VALUE))
                    .setDiscountRate(config.getDoubleProperty(DISCOUNT_RATE_PARAM_NAME, CostParameters.DISCOUNT_RATE_DEFAULT_VALUE))
                    .setLifetime(config.getIntProperty(LIFETIME_PARAM_NAME, CostParameters.LIFETIME_DEFAULT_VALUE));
                config.getOptionalStringListProperty(COST_SENSITIVITY_FACTORS_PARAM_NAME)
                    .ifPresent(prop -> parameters.setCostSensitivityFactors(prop));
            });
        return parameters;
    }

    public static OffshoreGridParameters load(Map<String, String> properties) {
        return new OffshoreGridParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(prop.split(","));
    }

    private static List<Integer> parseIntegers(List<String> values) {
        return values.stream().map(String::trim).map(Integer::parseInt).toList();
    }

    private static List<Double> parseDoubles(List<String> values) {
        return values.stream().map(String::trim).map(Double::parseDouble).toList();
    }

    private static Map<String, String> parseEntries(List<String> values) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String value : values) {
            String[] keyValue = value.split("=");
            if (keyValue.length != 2) {
                throw new IllegalArgumentException("Expected KEY=VALUE, got '" + value + "'");
            }
            entries.put(keyValue[0].trim(), keyValue[1].trim());
        }
        return entries;
    }

    /**
     * @param values entries such as {@code DE=1.0}
     */
    static Map<Country, Double> parseCountryFractions(List<String> values) {
        return parseEntries(values).entrySet().stream()
                .collect(Collectors.toMap(e -> Country.valueOf(e.getKey()), e -> Double.parseDouble(e.getValue()),
                    (f1, f2) -> f2, () -> new EnumMap<>(Country.class)));
    }

    /**
     * @param values entries such as {@code ENERGY_HUB=1.2}
     */
    private OffshoreGridParameters setCostSensitivityFactors(List<String> values) {
        parseEntries(values).forEach((assetClass, factor) ->
                costParameters.setSensitivityFactor(AssetClass.valueOf(assetClass), Double.parseDouble(factor)));
        return this;
    }

    public OffshoreGridParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(MODEL_TYPE_PARAM_NAME))
                .ifPresent(prop -> this.setModelType(ModelType.valueOf(prop)));
        Optional.ofNullable(properties.get(CROSS_BORDER_MODE_PARAM_NAME))
                .ifPresent(prop -> this.setCrossBorderMode(CrossBorderMode.valueOf(prop)));
        Optional.ofNullable(properties.get(PLANNING_MODE_PARAM_NAME))
                .ifPresent(prop -> this.setPlanningMode(PlanningMode.valueOf(prop)));
        Optional.ofNullable(properties.get(CABLE_COUNT_MODE_PARAM_NAME))
                .ifPresent(prop -> this.setCableCountMode(CableCountMode.valueOf(prop)));
        Optional.ofNullable(properties.get(STAGE_FAILURE_POLICY_PARAM_NAME))
                .ifPresent(prop -> this.setStageFailurePolicy(StageFailurePolicy.valueOf(prop)));
        Optional.ofNullable(properties.get(SOLVER_NAME_PARAM_NAME))
                .ifPresent(this::setSolverName);
        Optional.ofNullable(properties.get(ZERO_THRESHOLD_PARAM_NAME))
                .ifPresent(prop -> this.setZeroThreshold(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(TURBINE_CAPACITY_PARAM_NAME))
                .ifPresent(prop -> this.setTurbineCapacity(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(HUB_CAPACITY_LIMIT_PARAM_NAME))
                .ifPresent(prop -> this.setHubCapacityLimit(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SUBSTATION_CAPACITY_FACTOR_PARAM_NAME))
                .ifPresent(prop -> this.setSubstationCapacityFactor(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SUBSTATION_CAPACITY_WEIGHT_PARAM_NAME))
                .ifPresent(prop -> this.setSubstationCapacityWeight(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(WF_EH_MAX_DISTANCE_PARAM_NAME))
                .ifPresent(prop -> this.setMaxDistance(ConnectionType.WF_EH, Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(EH_ONSS_MAX_DISTANCE_PARAM_NAME))
                .ifPresent(prop -> this.setMaxDistance(ConnectionType.EH_ONSS, Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(WF_ONSS_MAX_DISTANCE_PARAM_NAME))
                .ifPresent(prop -> this.setMaxDistance(ConnectionType.WF_ONSS, Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(ONSS_ONSS_MAX_DISTANCE_PARAM_NAME))
                .ifPresent(prop -> this.setMaxDistance(ConnectionType.ONSS_ONSS, Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SINGLE_YEAR_PARAM_NAME))
                .ifPresent(prop -> this.setSingleYear(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(MULTI_YEARS_PARAM_NAME))
                .ifPresent(prop -> this.setMultiYears(parseIntegers(parseStringListProp(prop))));
        Optional.ofNullable(properties.get(DEVELOPMENT_FRACTIONS_PARAM_NAME))
                .ifPresent(prop -> this.setDevelopmentFractions(parseDoubles(parseStringListProp(prop))));
        Optional.ofNullable(properties.get(COUNTRY_CAPACITY_FRACTIONS_PARAM_NAME))
                .ifPresent(prop -> this.setCountryCapacityFractions(parseCountryFractions(parseStringListProp(prop))));
        Optional.ofNullable(properties.get(BASE_YEAR_PARAM_NAME))
                .ifPresent(prop -> costParameters.setBaseYear(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(DISCOUNT_RATE_PARAM_NAME))
                .ifPresent(prop -> costParameters.setDiscountRate(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(LIFETIME_PARAM_NAME))
                .ifPresent(prop -> costParameters.setLifetime(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(COST_SENSITIVITY_FACTORS_PARAM_NAME))
                .ifPresent(prop -> this.setCostSensitivityFactors(parseStringListProp(prop)));
        return this;
    }

    @Override
    public String toString() {
        return "OffshoreGridParameters("
                + "modelType=" + modelType
                + ", crossBorderMode=" + crossBorderMode
                + ", planningMode=" + planningMode
                + ", cableCountMode=" + cableCountMode
                + ", stageFailurePolicy=" + stageFailurePolicy
                + ", solverName=" + solverName
                + ", zeroThreshold=" + zeroThreshold
                + ", turbineCapacity=" + turbineCapacity
                + ", hubCapacityLimit=" + hubCapacityLimit
                + ", substationCapacityFactor=" + substationCapacityFactor
                + ", substationCapacityWeight=" + substationCapacityWeight
                + ", connectionThresholds=" + connectionThresholds
                + ", singleYear=" + singleYear
                + ", multiYears=" + multiYears
                + ", developmentFractions=" + developmentFractions
                + ", countryCapacityFractions=" + countryCapacityFractions
                + ", costParameters=" + costParameters
                + ")";
    }
}
