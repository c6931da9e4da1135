package com.mimecast.warden.config;

import com.mimecast.warden.handlers.ContentHandler;
import com.mimecast.warden.handlers.HandlerFactory;
import com.mimecast.warden.query.And;
import com.mimecast.warden.query.Expression;
import com.mimecast.warden.query.Field;
import com.mimecast.warden.query.Not;
import com.mimecast.warden.query.Or;
import com.mimecast.warden.query.Query;
import com.mimecast.warden.rules.HandlerStep;
import com.mimecast.warden.rules.Rule;
import com.mimecast.warden.rules.RuleTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a rule table from a rules JSON5 file.
 * <p>Format:
 * <pre>
 * {
 *   rules: [
 *     {
 *       name: "work",
 *       match: {allOf: [{from: ["@workplace.edu"]}, {not: [{subject: ["newsletter"]}]}]},
 *       steps: [{handler: "autoForwardReply"}, {move: "INBOX.Work"}]
 *     }
 *   ]
 * }
 * </pre>
 * <p>A match map may hold field keys ({@code from}, {@code to}, {@code cc}, {@code subject}) with a
 * <br>string or list of strings, and combinator keys ({@code anyOf}, {@code allOf}, {@code not}) with a list
 * <br>of match maps. Several entries in one map are OR-combined.
 * <p>Steps are either a bare name ({@code "expunge"}, {@code "delete"}) or a single entry map:
 * <br>{@code copy}, {@code move}, {@code setFlags}, {@code setFlagsAndMove} ({@code {flags, folder}})
 * <br>or {@code handler}.
 */
@SuppressWarnings("unchecked")
public class RuleTableLoader {
    private static final Logger log = LogManager.getLogger(RuleTableLoader.class);

    private final HandlerFactory handlerFactory;

    public RuleTableLoader(HandlerFactory handlerFactory) {
        this.handlerFactory = handlerFactory;
    }

    /**
     * Loads rules from a file.
     *
     * @param path File path.
     * @return RuleTable instance.
     * @throws ConfigurationException Unreadable file or invalid rule.
     */
    public RuleTable load(Path path) throws ConfigurationException {
        Map<String, Object> map;
        try {
            map = ConfigFoundation.readFile(path);
        } catch (IOException e) {
            throw configurationException("Unable to read rules " + path + ": " + e.getMessage(), e);
        }
        RuleTable table = load(new BasicConfig(map));
        log.info("Loaded {} rule(s) from {}", table.size(), path);
        return table;
    }

    /**
     * Loads rules from a parsed configuration.
     *
     * @param config Configuration holding a {@code rules} list.
     * @return RuleTable instance.
     * @throws ConfigurationException Invalid rule.
     */
    public RuleTable load(BasicConfig config) throws ConfigurationException {
        List<?> rules = config.getListProperty("rules");
        if (rules == null || rules.isEmpty()) {
            throw new ConfigurationException("No rules defined");
        }

        RuleTable.Builder builder = RuleTable.builder();
        int index = 0;
        for (Object entry : rules) {
            index++;
            if (!(entry instanceof Map)) {
                throw new ConfigurationException("Rule " + index + " is not an object");
            }
            BasicConfig rule = new BasicConfig((Map<String, Object>) entry);
            String name = rule.getStringProperty("name", "rule" + index);

            Map<String, Object> match = rule.getMapProperty("match");
            if (match == null) {
                throw new ConfigurationException("Rule " + name + " has no match");
            }

            try {
                builder.rule(new Rule(name, Query.root(expressions(match, name)), steps(rule.getListProperty("steps"), name)));
            } catch (IllegalArgumentException e) {
                throw configurationException("Rule " + name + ": " + e.getMessage(), e);
            }
        }
        return builder.build();
    }

    /**
     * Converts a match map to an expression list.
     */
    List<Expression> expressions(Map<String, Object> match, String rule) throws ConfigurationException {
        List<Expression> list = new ArrayList<>();
        for (Map.Entry<String, Object> entry : match.entrySet()) {
            switch (entry.getKey()) {
                case "from":
                    list.addAll(Query.fields(Field.FROM, strings(entry.getValue())));
                    break;
                case "to":
                    list.addAll(Query.fields(Field.TO, strings(entry.getValue())));
                    break;
                case "cc":
                    list.addAll(Query.fields(Field.CC, strings(entry.getValue())));
                    break;
                case "subject":
                    list.addAll(Query.fields(Field.SUBJECT, strings(entry.getValue())));
                    break;
                case "anyOf":
                    list.add(new Or(children(entry.getValue(), rule)));
                    break;
                case "allOf":
                    list.add(new And(children(entry.getValue(), rule)));
                    break;
                case "not":
                    list.add(new Not(children(entry.getValue(), rule)));
                    break;
                default:
                    throw new ConfigurationException("Rule " + rule + ": unknown match key " + entry.getKey());
            }
        }
        if (list.isEmpty()) {
            throw new ConfigurationException("Rule " + rule + ": empty match");
        }
        return list;
    }

    private List<Expression> children(Object value, String rule) throws ConfigurationException {
        if (!(value instanceof List)) {
            throw new ConfigurationException("Rule " + rule + ": combinator expects a list");
        }
        List<Expression> children = new ArrayList<>();
        for (Object child : (List<?>) value) {
            if (!(child instanceof Map)) {
                throw new ConfigurationException("Rule " + rule + ": combinator entries must be objects");
            }
            children.addAll(expressions((Map<String, Object>) child, rule));
        }
        return children;
    }

    private static String[] strings(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).toArray(String[]::new);
        }
        return new String[]{String.valueOf(value)};
    }

    /**
     * Converts a step list.
     */
    List<HandlerStep> steps(List<?> steps, String rule) throws ConfigurationException {
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("Rule " + rule + " has no steps");
        }
        List<HandlerStep> list = new ArrayList<>();
        for (Object step : steps) {
            if (step instanceof String) {
                list.add(namedStep((String) step, rule));
            } else if (step instanceof Map && ((Map<String, Object>) step).size() == 1) {
                Map.Entry<String, Object> entry = ((Map<String, Object>) step).entrySet().iterator().next();
                list.add(parameterisedStep(entry.getKey(), entry.getValue(), rule));
            } else {
                throw new ConfigurationException("Rule " + rule + ": invalid step " + step);
            }
        }
        return list;
    }

    private HandlerStep namedStep(String name, String rule) throws ConfigurationException {
        switch (name) {
            case "expunge":
                return HandlerStep.expunge();
            case "delete":
                return HandlerStep.delete();
            default:
                throw new ConfigurationException("Rule " + rule + ": unknown step " + name);
        }
    }

    private HandlerStep parameterisedStep(String name, Object value, String rule) throws ConfigurationException {
        switch (name) {
            case "expunge":
            case "delete":
                return namedStep(name, rule);
            case "copy":
                return HandlerStep.copy(String.valueOf(value));
            case "move":
                return HandlerStep.move(String.valueOf(value));
            case "setFlags":
                return HandlerStep.setFlags(String.valueOf(value));
            case "setFlagsAndMove":
                if (!(value instanceof Map)) {
                    throw new ConfigurationException("Rule " + rule + ": setFlagsAndMove expects {flags, folder}");
                }
                BasicConfig params = new BasicConfig((Map<String, Object>) value);
                return HandlerStep.setFlagsAndMove(params.getStringProperty("flags"), params.getStringProperty("folder"));
            case "handler":
                Optional<ContentHandler> handler = handlerFactory.getHandler(String.valueOf(value));
                if (handler.isEmpty()) {
                    throw new ConfigurationException("Rule " + rule + ": unknown handler " + value);
                }
                return HandlerStep.content(handler.get());
            default:
                throw new ConfigurationException("Rule " + rule + ": unknown step " + name);
        }
    }

    private static ConfigurationException configurationException(String message, Throwable cause) {
        ConfigurationException exception = new ConfigurationException(message);
        exception.setRootCause(cause);
        return exception;
    }
}
