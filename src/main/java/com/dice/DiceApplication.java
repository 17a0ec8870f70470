package com.dice;

import com.dice.engine.DiceEngine;
import com.dice.engine.ExplanationFormat;
import com.dice.evaluation.EvaluationResult;
import com.dice.exception.DiceException;
import com.dice.spring.EnableDice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating dice engine usage.
 * Evaluates the expressions given as arguments, or a few samples when there are none.
 */
@SpringBootApplication
@EnableDice
public class DiceApplication {

    private static final Logger log = LoggerFactory.getLogger(DiceApplication.class);

    private static final List<String> SAMPLES = List.of(
            "3d6+5",
            "(2d6+3)*2",
            "4d6>3",
            "2d6r1",
            "4d6ro<2",
            "d20 / 2"
    );

    public static void main(String[] args) {
        SpringApplication.run(DiceApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DiceEngine diceEngine) {
        return args -> {
            log.info("=== Dice Demo Started ===");

            List<String> expressions = args.length > 0 ? List.of(args) : SAMPLES;
            for (String expression : expressions) {
                try {
                    EvaluationResult result = diceEngine.evaluateDetailed(expression);
                    log.info("{} = {} (rolls {}, range {})",
                            expression, result.value(), result.rolls(), result.range());
                } catch (DiceException e) {
                    log.warn("Could not evaluate '{}': {}", expression, e.getMessage());
                }
            }

            String first = expressions.get(0);
            if (diceEngine.validate(first)) {
                log.info("Explanation of '{}':\n{}", first, diceEngine.explain(first, ExplanationFormat.TEXT));
            }
            log.info("Cache: {}", diceEngine.getCacheStats());
            log.info("=== Dice Demo Finished ===");
        };
    }
}
