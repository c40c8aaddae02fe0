package me.golemcore.verifybot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class VerifyBotApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(VerifyBotApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(VerifyBotApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(VerifyBotApplication.class.getMethod("main", String[].class));
    }

    @Test
    void shouldTranslateVerboseSwitches() {
        assertArrayEquals(new String[] { "--bot.verbose=true", "--bot.telegram.poll-timeout-seconds=10" },
                VerifyBotApplication.translateArguments(
                        new String[] { "-v", "--bot.telegram.poll-timeout-seconds=10" }));
        assertArrayEquals(new String[] { "--bot.verbose=true" },
                VerifyBotApplication.translateArguments(new String[] { "--verbose" }));
    }

    @Test
    void shouldPassThroughOtherArguments() {
        assertArrayEquals(new String[] { "-vv", "--bot.daemon.enabled=false" },
                VerifyBotApplication.translateArguments(new String[] { "-vv", "--bot.daemon.enabled=false" }));
        assertArrayEquals(new String[0], VerifyBotApplication.translateArguments(new String[0]));
    }
}
