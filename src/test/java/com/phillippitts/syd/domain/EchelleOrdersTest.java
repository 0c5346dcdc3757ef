package com.phillippitts.syd.domain;

import com.phillippitts.syd.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EchelleOrdersTest {

    @Test
    void parsesOrdersAndShift() {
        assertThat(EchelleOrders.parse("0+0")).isEqualTo(new EchelleOrders(0, 0));
        assertThat(EchelleOrders.parse("5+2")).isEqualTo(new EchelleOrders(5, 2));
        assertThat(EchelleOrders.parse("3-1")).isEqualTo(new EchelleOrders(3, -1));
    }

    @Test
    void bareCountMeansNoShift() {
        assertThat(EchelleOrders.parse(" 7 ")).isEqualTo(new EchelleOrders(7, 0));
    }

    @Test
    void rejectsOtherForms() {
        assertThatThrownBy(() -> EchelleOrders.parse("five"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> EchelleOrders.parse("3+"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> EchelleOrders.parse("-3"))
                .isInstanceOf(ConfigurationException.class);
    }
}
