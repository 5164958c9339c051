package factstore.core.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(StoreConfiguration.STORE_NAME_KEY);
        System.clearProperty(StoreConfiguration.CLEAR_ON_OPEN_KEY);
    }

    @Test
    void defaults() {
        StoreConfiguration config = StoreConfiguration.defaults();

        assertThat(config.getStoreName()).isEqualTo(StoreConfiguration.DEFAULT_STORE_NAME);
        assertThat(config.isClearOnOpen()).isFalse();
    }

    @Test
    void builderSetsValues() {
        StoreConfiguration config = StoreConfiguration.builder()
            .storeName("  facts ")
            .clearOnOpen(true)
            .build();

        assertThat(config.getStoreName()).isEqualTo("facts");
        assertThat(config.isClearOnOpen()).isTrue();
        assertThat(config.toString()).contains("facts");
    }

    @Test
    void blankStoreNameIsRejected() {
        assertThatThrownBy(() -> StoreConfiguration.builder().storeName(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromEnvironmentReadsSystemProperties() {
        System.setProperty(StoreConfiguration.STORE_NAME_KEY, "from-props");
        System.setProperty(StoreConfiguration.CLEAR_ON_OPEN_KEY, "TRUE");

        StoreConfiguration config = StoreConfiguration.fromEnvironment().build();

        assertThat(config.getStoreName()).isEqualTo("from-props");
        assertThat(config.isClearOnOpen()).isTrue();
    }
}
