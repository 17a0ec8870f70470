package com.dice.engine;

import com.dice.ast.DiceNode;
import com.dice.ast.NodeCounter;
import com.dice.cache.BoundedExpressionCache;
import com.dice.cache.CacheStats;
import com.dice.cache.ExpressionCache;
import com.dice.config.DiceConfig;
import com.dice.evaluation.DiceEvaluator;
import com.dice.evaluation.EvaluationContext;
import com.dice.evaluation.EvaluationResult;
import com.dice.evaluation.Range;
import com.dice.evaluation.RangeAnalyzer;
import com.dice.exception.DiceException;
import com.dice.explanation.DefaultExplanationRecorder;
import com.dice.explanation.Explanation;
import com.dice.explanation.ExplanationFormatter;
import com.dice.explanation.ExplanationRecorder;
import com.dice.expression.DiceExpressionParser;
import com.dice.expression.ParsedExpression;
import com.dice.random.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link DiceEngine}: parser, optional expression cache, evaluator and range analyzer
 * wired from one {@link DiceConfig}.
 * <p>
 * Safe to share between threads as long as the default random source is; the system source is,
 * and a seeded source serializes its draws.
 */
public class DefaultDiceEngine implements DiceEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultDiceEngine.class);

    private final DiceConfig config;
    private final DiceExpressionParser parser;
    private final ExpressionCache cache;
    private final DiceEvaluator evaluator;
    private final RangeAnalyzer rangeAnalyzer;
    private final RandomSource defaultRandom;

    public DefaultDiceEngine(DiceConfig config) {
        this(config, new DiceExpressionParser(config.limits()));
    }

    public DefaultDiceEngine(DiceConfig config, DiceExpressionParser parser) {
        this(config, parser, defaultRandom(config));
    }

    public DefaultDiceEngine(DiceConfig config, DiceExpressionParser parser, RandomSource defaultRandom) {
        this.config = config;
        this.parser = parser;
        this.cache = config.enableCaching() ? new BoundedExpressionCache(config.cacheSize()) : null;
        this.evaluator = new DiceEvaluator(config.maxRerolls(), config.divisionByZero());
        this.rangeAnalyzer = new RangeAnalyzer(config.divisionByZero(), config.explodingRangeMultiplier());
        this.defaultRandom = defaultRandom;

        log.info("DiceEngine initialized: maxRerolls={}, caching={}, cacheSize={}, divisionByZero={}, random={}",
                config.maxRerolls(), config.enableCaching(), config.cacheSize(), config.divisionByZero(),
                defaultRandom);
    }

    private static RandomSource defaultRandom(DiceConfig config) {
        if (config.randomSeed() != null) {
            return RandomSource.seeded(config.randomSeed());
        }
        return RandomSource.system();
    }

    @Override
    public long evaluate(String expression) {
        return evaluate(expression, defaultRandom);
    }

    @Override
    public long evaluate(String expression, RandomSource random) {
        DiceNode ast = read(expression).ast();
        long value = evaluator.evaluate(ast, random);
        log.debug("Evaluated '{}' = {}", expression, value);
        return value;
    }

    @Override
    public EvaluationResult evaluateDetailed(String expression) {
        return evaluateDetailed(expression, defaultRandom);
    }

    @Override
    public EvaluationResult evaluateDetailed(String expression, RandomSource random) {
        DiceNode ast = read(expression).ast();
        return run(expression, ast, new EvaluationContext(random));
    }

    @Override
    public ExplainedResult evaluateWithExplanation(String expression) {
        return evaluateWithExplanation(expression, defaultRandom);
    }

    @Override
    public ExplainedResult evaluateWithExplanation(String expression, RandomSource random) {
        ParsedExpression parsed = read(expression);
        ExplanationRecorder recorder = new DefaultExplanationRecorder(expression, config.explanation());

        recorder.recordTokenization(parsed.tokenTexts());
        recorder.recordParsing(parsed.ast().toNotation(), NodeCounter.count(parsed.ast()));

        EvaluationResult result = run(expression, parsed.ast(), new EvaluationContext(random, recorder));
        recorder.recordFinalResult(result.value());
        recorder.recordExecutionTime(result.executionTimeMs());

        return new ExplainedResult(result, recorder.toExplanation());
    }

    @Override
    public String explain(String expression, ExplanationFormat format) {
        Explanation explanation = evaluateWithExplanation(expression).explanation();
        return switch (format) {
            case TEXT -> ExplanationFormatter.toText(explanation, config.explanation());
            case MARKDOWN -> ExplanationFormatter.toMarkdown(explanation, config.explanation());
        };
    }

    @Override
    public DiceNode parse(String expression) {
        return read(expression).ast();
    }

    @Override
    public boolean validate(String expression) {
        return getValidationErrors(expression).isEmpty();
    }

    @Override
    public List<String> getValidationErrors(String expression) {
        try {
            read(expression);
            return List.of();
        } catch (DiceException e) {
            log.debug("Expression '{}' is invalid: {}", expression, e.getMessage());
            return List.of(e.getMessage());
        }
    }

    @Override
    public Range range(String expression) {
        return rangeAnalyzer.range(read(expression).ast());
    }

    @Override
    public void clearCache() {
        if (cache != null) {
            cache.clear();
            log.debug("Expression cache cleared");
        }
    }

    @Override
    public CacheStats getCacheStats() {
        if (cache == null) {
            return new CacheStats(0, 0, 0, 0, 0);
        }
        return cache.getStats();
    }

    public DiceConfig getConfig() {
        return config;
    }

    public RandomSource getDefaultRandom() {
        return defaultRandom;
    }

    private EvaluationResult run(String expression, DiceNode ast, EvaluationContext context) {
        long start = System.nanoTime();
        long value = evaluator.evaluate(ast, context);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        Range range = rangeAnalyzer.range(ast);

        boolean overBudget = elapsedMs > config.maxExecutionTimeMs();
        if (overBudget) {
            log.warn("Evaluation of '{}' took {}ms, over the {}ms budget",
                    expression, elapsedMs, config.maxExecutionTimeMs());
        }
        log.debug("Evaluated '{}' = {} in {}ms, range {}", expression, value, elapsedMs, range);

        return new EvaluationResult(expression, value, context.getRolls(), range.min(), range.max(),
                elapsedMs, context.getMetrics(), overBudget);
    }

    private ParsedExpression read(String expression) {
        if (cache == null) {
            return parser.read(expression);
        }

        Optional<ParsedExpression> cached = cache.get(expression);
        if (cached.isPresent()) {
            log.debug("Cache hit for expression '{}'", expression);
            return cached.get();
        }

        log.debug("Cache miss for expression '{}'", expression);
        ParsedExpression parsed = parser.read(expression);
        cache.put(expression, parsed);
        return parsed;
    }
}
