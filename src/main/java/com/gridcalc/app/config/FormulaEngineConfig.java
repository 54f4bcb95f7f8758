package com.gridcalc.app.config;

import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.GridEvaluator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the formula engine, which has no Spring dependencies of its own, as beans.
 */
@Configuration
public class FormulaEngineConfig {

    @Bean
    public FormulaEvaluator formulaEvaluator() {
        return new FormulaEvaluator();
    }

    @Bean
    public GridEvaluator gridEvaluator(FormulaEvaluator formulaEvaluator, GridCalcProperties properties) {
        GridCalcProperties.EvaluationSettings evaluation = properties.getEvaluation();
        return new GridEvaluator(formulaEvaluator, evaluation.getCyclePolicy(), evaluation.isCacheEnabled());
    }
}
