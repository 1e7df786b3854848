package me.subaru.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.subaru.bot.domain.model.BuiltinCommand;
import me.subaru.bot.domain.model.CommandDefinition;
import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ExecutionKind;
import me.subaru.bot.domain.model.UserProfile;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses {@code commands.json} and {@code users.json} into a
 * {@link CommandTable}. Parsing is all-or-nothing: the first problem aborts with
 * a {@link ConfigRegistry.ConfigParseException} and no partial table escapes.
 *
 * <pre>
 * {"commands": {"!ping": {"description": "...", "allowed_users": [], "type": "builtin"},
 *               "!backup": {"type": "shell", "script": "/opt/backup.sh", "allowed_users": ["@admin:hs"]}}}
 * </pre>
 *
 * A builtin entry names its handler with {@code "builtin"}; when omitted the
 * token without prefix is used.
 */
public class CommandTableParser {

    private final ObjectMapper strictMapper;
    private final String prefix;

    public CommandTableParser(ObjectMapper objectMapper, String prefix) {
        this.strictMapper = objectMapper.copy().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.prefix = prefix;
    }

    public CommandTable parse(String commandsJson, String usersJson, Instant loadedAt)
            throws ConfigRegistry.ConfigParseException {
        Map<String, CommandDefinition> commands = parseCommands(commandsJson);
        Map<String, UserProfile> users = parseUsers(usersJson);
        return new CommandTable(commands, users, loadedAt);
    }

    Map<String, CommandDefinition> parseCommands(String json) throws ConfigRegistry.ConfigParseException {
        JsonNode root = readTree("commands", json);
        JsonNode commandsNode = root.path("commands");
        if (!commandsNode.isObject()) {
            throw new ConfigRegistry.ConfigParseException("commands: top-level \"commands\" object is missing");
        }

        Map<String, CommandDefinition> commands = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = commandsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            CommandDefinition definition = parseCommand(field.getKey(), field.getValue());
            if (commands.putIfAbsent(definition.token(), definition) != null) {
                throw new ConfigRegistry.ConfigParseException(
                        "commands: duplicate command token " + definition.token());
            }
        }
        return commands;
    }

    private CommandDefinition parseCommand(String rawToken, JsonNode node) throws ConfigRegistry.ConfigParseException {
        String token = rawToken.trim().toLowerCase(Locale.ROOT);
        if (token.length() <= prefix.length() || !token.startsWith(prefix) || token.contains(" ")) {
            throw new ConfigRegistry.ConfigParseException(
                    "commands: invalid token '" + rawToken + "' (must start with " + prefix + ")");
        }
        if (!node.isObject()) {
            throw new ConfigRegistry.ConfigParseException("commands: entry " + token + " must be an object");
        }

        String type = node.path("type").asText("builtin");
        ExecutionKind kind = ExecutionKind.fromConfigType(type)
                .orElseThrow(() -> new ConfigRegistry.ConfigParseException(
                        "commands: unknown type '" + type + "' for " + token));
        String description = node.path("description").asText("");
        List<String> allowedUsers = parseAllowedUsers(token, node.path("allowed_users"));

        if (kind == ExecutionKind.BUILTIN) {
            String builtinName = node.hasNonNull("builtin")
                    ? node.get("builtin").asText()
                    : token.substring(prefix.length());
            BuiltinCommand builtin = BuiltinCommand.fromName(builtinName)
                    .orElseThrow(() -> new ConfigRegistry.ConfigParseException(
                            "commands: unknown builtin '" + builtinName + "' for " + token));
            return CommandDefinition.builtin(token, description, builtin, allowedUsers);
        }

        String script = node.path("script").asText("");
        if (script.isBlank()) {
            throw new ConfigRegistry.ConfigParseException("commands: " + token + " has no script");
        }
        return CommandDefinition.script(token, description, script, allowedUsers);
    }

    private List<String> parseAllowedUsers(String token, JsonNode node) throws ConfigRegistry.ConfigParseException {
        List<String> users = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return users;
        }
        if (!node.isArray()) {
            throw new ConfigRegistry.ConfigParseException("commands: allowed_users of " + token + " must be a list");
        }
        for (JsonNode user : node) {
            if (!user.isTextual() || user.asText().isBlank()) {
                throw new ConfigRegistry.ConfigParseException(
                        "commands: allowed_users of " + token + " contains a non-string entry");
            }
            users.add(user.asText().trim());
        }
        return users;
    }

    Map<String, UserProfile> parseUsers(String json) throws ConfigRegistry.ConfigParseException {
        Map<String, UserProfile> users = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return users;
        }
        JsonNode root = readTree("users", json);
        JsonNode usersNode = root.path("users");
        if (usersNode.isMissingNode()) {
            return users;
        }
        if (!usersNode.isObject()) {
            throw new ConfigRegistry.ConfigParseException("users: \"users\" must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = usersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                users.put(field.getKey(), strictMapper.treeToValue(field.getValue(), UserProfile.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ConfigRegistry.ConfigParseException(
                        "users: invalid entry for " + field.getKey() + ": " + e.getMessage(), e);
            }
        }
        return users;
    }

    private JsonNode readTree(String label, String json) throws ConfigRegistry.ConfigParseException {
        if (json == null || json.isBlank()) {
            throw new ConfigRegistry.ConfigParseException(label + ": file is empty");
        }
        try {
            JsonNode node = strictMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new ConfigRegistry.ConfigParseException(label + ": top-level value must be an object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ConfigRegistry.ConfigParseException(label + ": " + e.getOriginalMessage(), e);
        }
    }
}
