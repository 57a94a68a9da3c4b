package com.quotepay.payments.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderReferenceTest {

	@Test
	void encodesWithPrefix() {
		assertThat(OrderReference.encode(List.of("Q1", "Q2"))).isEqualTo("Order_Q1,Q2");
	}

	@Test
	void parsesPrefixedAndBareLists() {
		assertThat(OrderReference.parse("Order_Q1,Q2")).contains(List.of("Q1", "Q2"));
		assertThat(OrderReference.parse(" Q7 , Q8 ,Q7")).contains(List.of("Q7", "Q8"));
	}

	@Test
	void rejectsImplausibleReferences() {
		assertThat(OrderReference.parse(null)).isEmpty();
		assertThat(OrderReference.parse("Order_")).isEmpty();
		assertThat(OrderReference.parse("Order_Q1,<script>")).isEmpty();
	}

	@Test
	void encodeRequiresQuotes() {
		assertThatThrownBy(() -> OrderReference.encode(List.of())).isInstanceOf(IllegalArgumentException.class);
	}
}
