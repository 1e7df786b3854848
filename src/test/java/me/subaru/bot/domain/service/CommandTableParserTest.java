package me.subaru.bot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.subaru.bot.domain.model.BuiltinCommand;
import me.subaru.bot.domain.model.CommandDefinition;
import me.subaru.bot.domain.model.CommandTable;
import me.subaru.bot.domain.model.ExecutionKind;
import me.subaru.bot.domain.model.UserProfile;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandTableParserTest {

    private static final Instant LOADED_AT = Instant.parse("2026-03-01T10:00:00Z");

    private final CommandTableParser parser = new CommandTableParser(new ObjectMapper(), "!");

    @Test
    void shouldParseBuiltinAndScriptCommands() throws Exception {
        String commands = """
                {"commands": {
                  "!ping": {"description": "Check", "type": "builtin"},
                  "!espacio": {"type": "builtin", "builtin": "disk-usage"},
                  "!backup": {"type": "shell", "script": "/opt/backup.sh", "allowed_users": ["@admin:hs"]}
                }}
                """;

        CommandTable table = parser.parse(commands, null, LOADED_AT);

        assertEquals(3, table.commands().size());
        CommandDefinition ping = table.find("!ping").orElseThrow();
        assertEquals(ExecutionKind.BUILTIN, ping.kind());
        assertEquals(BuiltinCommand.PING, ping.builtin());
        assertEquals(BuiltinCommand.DISK_USAGE, table.find("!espacio").orElseThrow().builtin());
        CommandDefinition backup = table.find("!backup").orElseThrow();
        assertEquals(ExecutionKind.EXTERNAL_SCRIPT, backup.kind());
        assertEquals(List.of("@admin:hs"), backup.allowedUsers());
        assertEquals(LOADED_AT, table.loadedAt());
    }

    @Test
    void shouldNormalizeTokensToLowerCase() throws Exception {
        CommandTable table = parser.parse("{\"commands\": {\"!PING\": {}}}", null, LOADED_AT);

        assertTrue(table.find("!ping").isPresent());
    }

    @Test
    void shouldRejectDuplicateKeys() {
        String commands = "{\"commands\": {\"!ping\": {}, \"!ping\": {}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectTokensThatCollideAfterNormalization() {
        String commands = "{\"commands\": {\"!ping\": {}, \"!Ping\": {}}}";

        ConfigRegistry.ConfigParseException e = assertThrows(ConfigRegistry.ConfigParseException.class,
                () -> parser.parse(commands, null, LOADED_AT));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    void shouldRejectUnknownBuiltin() {
        String commands = "{\"commands\": {\"!anime\": {\"type\": \"builtin\"}}}";

        ConfigRegistry.ConfigParseException e = assertThrows(ConfigRegistry.ConfigParseException.class,
                () -> parser.parse(commands, null, LOADED_AT));
        assertTrue(e.getMessage().contains("unknown builtin"));
    }

    @Test
    void shouldRejectScriptWithoutPath() {
        String commands = "{\"commands\": {\"!backup\": {\"type\": \"shell\"}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectNonListAllowedUsers() {
        String commands = "{\"commands\": {\"!ping\": {\"allowed_users\": \"@admin:hs\"}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectNonStringAllowedUser() {
        String commands = "{\"commands\": {\"!ping\": {\"allowed_users\": [42]}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectTokenWithoutPrefix() {
        String commands = "{\"commands\": {\"ping\": {}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectUnknownType() {
        String commands = "{\"commands\": {\"!ping\": {\"type\": \"python\"}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse(commands, null, LOADED_AT));
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(ConfigRegistry.ConfigParseException.class,
                () -> parser.parse("{\"commands\": {", null, LOADED_AT));
        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse("", null, LOADED_AT));
        assertThrows(ConfigRegistry.ConfigParseException.class, () -> parser.parse("{}", null, LOADED_AT));
    }

    @Test
    void shouldParseUserProfiles() throws Exception {
        String users = """
                {"users": {"@alice:example.org": {
                  "ai_enabled": true,
                  "triggers": {"subaru": {"api_key": "k", "model": "gemini-2.0-flash", "max_history": 10}},
                  "realdebrid_api_key": "rd"
                }}}
                """;

        CommandTable table = parser.parse("{\"commands\": {}}", users, LOADED_AT);

        UserProfile profile = table.profile("@alice:example.org").orElseThrow();
        assertTrue(profile.aiEnabled());
        assertEquals("rd", profile.realdebridApiKey());
        assertEquals("subaru", profile.primaryTrigger().orElseThrow().getKey());
        assertEquals(10, profile.primaryTrigger().orElseThrow().getValue().maxHistory());
    }

    @Test
    void shouldRejectInvalidUserEntry() {
        String users = "{\"users\": {\"@alice:example.org\": {\"ai_enabled\": {\"nested\": true}}}}";

        assertThrows(ConfigRegistry.ConfigParseException.class,
                () -> parser.parse("{\"commands\": {}}", users, LOADED_AT));
    }
}
