package org.hackvm.translator.api;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TranslatorOptionsTest {

    @Test
    @Tag("unit")
    void readsTranslatorBlock() {
        TranslatorOptions options = TranslatorOptions.fromConfig(ConfigFactory.parseString("""
                translator {
                  bootstrap = ALWAYS
                  entry-function = "Main.main"
                  stack-origin = 300
                  annotate = false
                  end-loop = false
                }
                """));

        assertThat(options).isEqualTo(new TranslatorOptions(BootstrapMode.ALWAYS, "Main.main", 300, false, false));
    }

    @Test
    @Tag("unit")
    void missingKeysFallBackToDefaults() {
        TranslatorOptions options = TranslatorOptions.fromConfig(ConfigFactory.parseString("translator.annotate = false"));

        assertThat(options.annotate()).isFalse();
        assertThat(options.bootstrapMode()).isEqualTo(BootstrapMode.AUTO);
        assertThat(options.entryFunction()).isEqualTo("Sys.init");
        assertThat(options.stackOrigin()).isEqualTo(256);
        assertThat(options.endLoop()).isTrue();
        assertThat(TranslatorOptions.fromConfig(ConfigFactory.empty())).isEqualTo(TranslatorOptions.defaults());
    }

    @Test
    @Tag("unit")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> TranslatorOptions.fromConfig(ConfigFactory.parseString("translator.bootstrap = sometimes")))
                .isInstanceOf(ConfigException.BadValue.class);
        assertThatThrownBy(() -> TranslatorOptions.fromConfig(ConfigFactory.parseString("translator.stack-origin = 5")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("stackOrigin");
        assertThatThrownBy(() -> TranslatorOptions.fromConfig(ConfigFactory.parseString("translator.entry-function = \" \"")))
                .isInstanceOf(ConfigException.BadValue.class);
        assertThatThrownBy(() -> TranslatorOptions.fromConfig(ConfigFactory.parseString("translator.annotate = maybe")))
                .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    @Tag("unit")
    void bootstrapModeDecidesPerInputKind() {
        assertThat(BootstrapMode.AUTO.appliesTo(true)).isTrue();
        assertThat(BootstrapMode.AUTO.appliesTo(false)).isFalse();
        assertThat(BootstrapMode.ALWAYS.appliesTo(false)).isTrue();
        assertThat(BootstrapMode.NEVER.appliesTo(true)).isFalse();
        assertThat(BootstrapMode.parse(" Never ")).isEqualTo(BootstrapMode.NEVER);
    }
}
