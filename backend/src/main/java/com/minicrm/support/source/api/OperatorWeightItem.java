package com.minicrm.support.source.api;

public record OperatorWeightItem(String operator_id, String operator_name, int weight) {
}
