/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringSubstitutor;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import lombok.extern.log4j.Log4j2;

@Log4j2
public class ToolHelper {

    public static final Gson gson = new GsonBuilder().serializeNulls().create();

    /**
     * Load a JSON object from the resources of the invoking class
     * @param source class which calls this function
     * @param fileName the resource file name
     * @return the parsed object, empty if the resource is missing or unreadable
     */
    public static Map<String, Object> loadJsonResource(Class<?> source, String fileName) {
        try (InputStream ins = source.getResourceAsStream(fileName)) {
            if (ins != null) {
                String content = new String(ins.readAllBytes(), StandardCharsets.UTF_8);
                return gson.fromJson(content, TypeToken.getParameterized(Map.class, String.class, Object.class).getType());
            }
            log.warn("Resource {} not found next to {}", fileName, source.getName());
        } catch (IOException e) {
            log.error("Failed to load resource file: {}", fileName, e);
        }
        return new HashMap<>();
    }

    /**
     * Extracts required parameters from the input parameter map based on tool attributes.
     * If the attributes contain a list of required parameters, only those parameters are extracted.
     * Otherwise, all parameters are returned.
     *
     * @param parameters The input parameters map to extract from
     * @param attributes The tool attributes containing required parameter information
     * @return A map containing only the required parameters or all parameters if no required parameters are specified
     */
    public static Map<String, String> extractRequiredParameters(Map<String, String> parameters, Map<String, ?> attributes) {
        Map<String, String> extractedParameters = new HashMap<>();
        if (parameters == null) {
            return extractedParameters;
        }
        if (attributes != null && attributes.containsKey(ToolConstants.TOOL_REQUIRED_PARAMS)) {
            List<String> requiredParameters = parseStringList(String.valueOf(attributes.get(ToolConstants.TOOL_REQUIRED_PARAMS)));
            for (String requiredParameter : requiredParameters) {
                extractedParameters.put(requiredParameter, parameters.get(requiredParameter));
            }
        } else {
            extractedParameters.putAll(parameters);
        }
        return extractedParameters;
    }

    /**
     * Extracts all relevant parameters including required parameters and nested parameters from the 'input' field.
     * The 'input' field is expected to contain a JSON object of string values. Variable substitution is performed on
     * it using the format ${parameters.key}.
     *
     * @param parameters The input parameters map to extract from
     * @param attributes The tool attributes containing parameter requirements
     * @return A map containing all extracted parameters including those from the 'input' field
     */
    public static Map<String, String> extractInputParameters(Map<String, String> parameters, Map<String, ?> attributes) {
        Map<String, String> extractedParameters = extractRequiredParameters(parameters, attributes);
        if (parameters != null && parameters.containsKey(ToolConstants.INPUT_PARAM)) {
            try {
                StringSubstitutor stringSubstitutor = new StringSubstitutor(parameters, "${parameters.", "}");
                String input = stringSubstitutor.replace(parameters.get(ToolConstants.INPUT_PARAM));
                extractedParameters.put(ToolConstants.INPUT_PARAM, input);
                Map<String, String> inputParameters = gson
                    .fromJson(input, TypeToken.getParameterized(Map.class, String.class, String.class).getType());
                extractedParameters.putAll(inputParameters);
            } catch (Exception exception) {
                log.info("fail extract parameters from key 'input' due to{}", exception.getMessage());
            }
        }
        return extractedParameters;
    }

    /**
     * Parse a list of names given either as a JSON array of strings or as a comma separated list.
     * @param value the raw parameter
     * @return trimmed, non-blank names in their original order
     */
    public static List<String> parseStringList(String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        String trimmed = value.trim();
        List<String> names;
        if (trimmed.startsWith("[")) {
            try {
                names = Arrays.asList(gson.fromJson(trimmed, String[].class));
            } catch (Exception e) {
                throw new IllegalArgumentException("Invalid list parameter: must be a JSON array of strings, got '" + value + "'");
            }
        } else {
            names = Arrays.asList(trimmed.split(","));
        }
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            if (StringUtils.isNotBlank(name)) {
                result.add(name.trim());
            }
        }
        return result;
    }
}
