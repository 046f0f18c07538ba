package com.example.regreport.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeySpaceTest {

    @Test
    void shouldBuildPositionKeysFromColumnNames() {
        assertThat(KeySpace.POSITION.getKeyFields())
                .containsExactly("SECURITY_ID", "INVESTMENT_TYPE", "LT_ST");
        assertThat(KeySpace.POSITION.gapColumns())
                .startsWith("KEY", "SECURITY_ID", "INVESTMENT_TYPE", "LT_ST", "ISIN");
    }

    @Test
    void shouldListKeyFieldsPerKeySpace() {
        assertThat(KeySpace.TRANSACTION_TYPE.getKeyFields())
                .containsExactly("GROUP_ACCOUNT", "SECURITY_TYPE", "INVESTMENTS");
        assertThat(KeySpace.INVESTMENT_TYPE.getKeyFields()).containsExactly("SECURITY_TYPE", "LT_ST");
        assertThat(KeySpace.INVESTMENT.getKeyFields()).containsExactly("SECURITY_ID", "SECURITY_TYPE");
        assertThat(KeySpace.ACCOUNT.getKeyFields()).containsExactly("ACCOUNT_NO", "ACCOUNT_NO2", "ACCOUNT_NAME");
    }

    @Test
    void shouldResolveGapSheetNames() {
        assertThat(KeySpace.fromSheetName(" missing position mapping ")).contains(KeySpace.POSITION);
        assertThat(KeySpace.fromSheetName("Sheet1")).isEmpty();
    }
}
