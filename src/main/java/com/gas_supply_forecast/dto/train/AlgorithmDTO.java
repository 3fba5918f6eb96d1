package com.gas_supply_forecast.dto.train;

import java.util.List;

public record AlgorithmDTO(String name, String displayName, List<String> predictionColumns) {
}
