package com.jz.honeypot.domain.entity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvidenceTest {

    @Test
    void mergeIsUnionAndNeverRemoves() {
        Evidence session = new Evidence();
        session.addLink("bit.ly/a1");
        session.addKeyword("otp");

        Evidence message = new Evidence();
        message.addLink("bit.ly/b2");
        message.addPhoneNumber("9123456789");

        session.mergeFrom(message);
        session.mergeFrom(new Evidence());

        assertThat(session.getLinks()).containsExactly("bit.ly/a1", "bit.ly/b2");
        assertThat(session.getPhoneNumbers()).containsExactly("9123456789");
        assertThat(session.getKeywords()).containsExactly("otp");
    }

    @Test
    void copyIsDetached() {
        Evidence original = new Evidence();
        original.addPaymentHandle("raj@okaxis");

        Evidence copy = original.copy();
        copy.addPaymentHandle("x1@ybl");

        assertThat(original.getPaymentHandles()).containsExactly("raj@okaxis");
        assertThat(copy.getPaymentHandles()).containsExactly("raj@okaxis", "x1@ybl");
    }

    @Test
    void viewsAreReadOnly() {
        Evidence e = new Evidence();
        assertThatThrownBy(() -> e.getLinks().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void duplicatesAndBlanksAreIgnored() {
        Evidence e = new Evidence();
        e.addAccountNumber("123456789");
        e.addAccountNumber("123456789");
        e.addAccountNumber("");
        e.addAccountNumber(null);

        assertThat(e.getAccountNumbers()).containsExactly("123456789");
    }

    @Test
    void sortedSnapshotIsOrdered() {
        assertThat(Evidence.sorted(List.of("b", "a", "c"))).containsExactly("a", "b", "c");
    }
}
