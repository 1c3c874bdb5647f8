package com.phillippitts.voiceorders.service.orders;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderRequestParserTest {

    @Test
    void extractsNumberAfterOrderNumberIs() {
        assertThat(OrderRequestParser.extractOrderNumber("My order number is 1003"))
                .contains("1003");
    }

    @Test
    void extractsNumberAfterOrderHash() {
        assertThat(OrderRequestParser.extractOrderNumber("Can you check order #2045 for me?"))
                .contains("2045");
        assertThat(OrderRequestParser.extractOrderNumber("order no. 777 please"))
                .contains("777");
        assertThat(OrderRequestParser.extractOrderNumber("ORDER: 12345"))
                .contains("12345");
    }

    @Test
    void explicitOrderPhrasingWinsOverEarlierNumbers() {
        assertThat(OrderRequestParser.extractOrderNumber("I paid 250 dollars for order 1003"))
                .contains("1003");
    }

    @Test
    void fallsBackToFirstStandaloneNumber() {
        assertThat(OrderRequestParser.extractOrderNumber("it's 1003 and then 2004"))
                .contains("1003");
    }

    @Test
    void fallbackAlsoMatchesUnrelatedNumbers() {
        assertThat(OrderRequestParser.extractOrderNumber("I spent 500 on it"))
                .contains("500");
    }

    @Test
    void ignoresNumbersShorterThanThreeDigits() {
        assertThat(OrderRequestParser.extractOrderNumber("order 12")).isEmpty();
        assertThat(OrderRequestParser.extractOrderNumber("I have 2 questions")).isEmpty();
    }

    @Test
    void handlesNullAndBlankText() {
        assertThat(OrderRequestParser.extractOrderNumber(null)).isEmpty();
        assertThat(OrderRequestParser.extractOrderNumber("   ")).isEmpty();
        assertThat(OrderRequestParser.isOrderStatusRequest(null)).isFalse();
        assertThat(OrderRequestParser.isOrderStatusRequest("")).isFalse();
    }

    @Test
    void detectsOrderStatusIntent() {
        assertThat(OrderRequestParser.isOrderStatusRequest("What's my order status?")).isTrue();
        assertThat(OrderRequestParser.isOrderStatusRequest("Can you TRACK MY ORDER")).isTrue();
        assertThat(OrderRequestParser.isOrderStatusRequest("I'd like to check my order")).isTrue();
        assertThat(OrderRequestParser.isOrderStatusRequest("any order update?")).isTrue();
        assertThat(OrderRequestParser.isOrderStatusRequest("what is the status of my order")).isTrue();
    }

    @Test
    void doesNotDetectIntentInUnrelatedText() {
        assertThat(OrderRequestParser.isOrderStatusRequest("Hello there")).isFalse();
        assertThat(OrderRequestParser.isOrderStatusRequest("I want to place an order")).isFalse();
    }
}
