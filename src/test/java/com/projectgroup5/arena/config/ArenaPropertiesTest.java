package com.projectgroup5.arena.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArenaProperties} binding.
 */
class ArenaPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(ArenaProperties.class)
    static class BindingConfig {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(BindingConfig.class);

    @Test
    void bind_defaults_areAccepted() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            ArenaProperties settings = context.getBean(ArenaProperties.class);
            assertThat(settings.getAmmoSpawnInterval()).isEqualTo(300);
            assertThat(settings.getRadius().getRock()).isEqualTo(20);
        });
    }

    @Test
    void bind_overrides_areApplied() {
        contextRunner.withPropertyValues("arena.gun-spawn-interval=60", "arena.radius.player=12")
                .run(context -> {
                    ArenaProperties settings = context.getBean(ArenaProperties.class);
                    assertThat(settings.getGunSpawnInterval()).isEqualTo(60);
                    assertThat(settings.getRadius().getPlayer()).isEqualTo(12);
                });
    }

    @Test
    void bind_zeroAmmoSpawnInterval_failsStartup() {
        contextRunner.withPropertyValues("arena.ammo-spawn-interval=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void bind_zeroGunSpawnInterval_failsStartup() {
        contextRunner.withPropertyValues("arena.gun-spawn-interval=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void bind_negativeRadius_failsStartup() {
        contextRunner.withPropertyValues("arena.radius.bullet=-2")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void bind_zeroSpawnCount_isAllowed() {
        contextRunner.withPropertyValues("arena.ammo-spawn-count=0", "arena.initial-rocks=0")
                .run(context -> assertThat(context).hasNotFailed());
    }
}
