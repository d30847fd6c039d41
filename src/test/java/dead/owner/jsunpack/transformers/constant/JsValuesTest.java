package dead.owner.jsunpack.transformers.constant;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class JsValuesTest {

    @Test
    void testStringToNumberConversion() {
        assertThat(JsValues.toNumber("  42 ")).isEqualTo(42.0);
        assertThat(JsValues.toNumber("")).isEqualTo(0.0);
        assertThat(JsValues.toNumber("0x10")).isEqualTo(16.0);
        assertThat(JsValues.toNumber("0b101")).isEqualTo(5.0);
        assertThat(JsValues.toNumber("1.5e3")).isEqualTo(1500.0);
        assertThat(JsValues.toNumber("-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(JsValues.toNumber("12px")).isNaN();
        assertThat(JsValues.toNumber(true)).isEqualTo(1.0);
    }

    @Test
    void testNumberToStringMatchesJavaScriptFormatting() {
        assertThat(JsValues.toJsString(1.0)).isEqualTo("1");
        assertThat(JsValues.toJsString(-0.0)).isEqualTo("0");
        assertThat(JsValues.toJsString(0.5)).isEqualTo("0.5");
        assertThat(JsValues.toJsString(123456789.0)).isEqualTo("123456789");
        assertThat(JsValues.toJsString(1e21)).isEqualTo("1e+21");
        assertThat(JsValues.toJsString(1.5e-7)).isEqualTo("1.5e-7");
        assertThat(JsValues.toJsString(Double.NaN)).isEqualTo("NaN");
        assertThat(JsValues.toJsString(false)).isEqualTo("false");
    }

    @Test
    void testTruthiness() {
        assertThat(JsValues.toBoolean(0.0)).isFalse();
        assertThat(JsValues.toBoolean(Double.NaN)).isFalse();
        assertThat(JsValues.toBoolean(-3.0)).isTrue();
        assertThat(JsValues.toBoolean("")).isFalse();
        assertThat(JsValues.toBoolean("0")).isTrue();
    }

    @Test
    void testInt32Wrapping() {
        assertThat(JsValues.toInt32(4294967301.0)).isEqualTo(5);
        assertThat(JsValues.toInt32(2147483648.0)).isEqualTo(Integer.MIN_VALUE);
        assertThat(JsValues.toInt32(-1.5)).isEqualTo(-1);
        assertThat(JsValues.toUint32(-1.0)).isEqualTo(4294967295L);
    }

    @Test
    void testEquality() {
        assertThat(JsValues.looseEquals("1", 1.0)).isTrue();
        assertThat(JsValues.looseEquals(true, 1.0)).isTrue();
        assertThat(JsValues.looseEquals("", false)).isTrue();
        assertThat(JsValues.strictEquals("1", 1.0)).isFalse();
        assertThat(JsValues.strictEquals(Double.NaN, Double.NaN)).isFalse();
        assertThat(JsValues.typeOf("x")).isEqualTo("string");
    }
}
