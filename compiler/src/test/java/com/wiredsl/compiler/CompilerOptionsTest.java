package com.wiredsl.compiler;

import com.wiredsl.compiler.ir.DevicePreset;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

class CompilerOptionsTest {

    @Test
    void testLoadFromClasspath() {
        CompilerOptions options = CompilerOptions.load();

        assertFalse(options.debug());
        assertEquals(DevicePreset.DESKTOP, options.defaultDevice());
        assertTrue(options.strictUnknownComponents());
    }

    @Test
    void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("wire.debug", "true");
        props.setProperty("wire.device", " Mobile ");
        props.setProperty("wire.strictUnknownComponents", "false");

        CompilerOptions options = CompilerOptions.fromProperties(props);

        assertTrue(options.debug());
        assertEquals(DevicePreset.MOBILE, options.defaultDevice());
        assertFalse(options.strictUnknownComponents());
    }

    @Test
    void testEmptyPropertiesUseDefaults() {
        assertEquals(CompilerOptions.defaults(), CompilerOptions.fromProperties(new Properties()));
    }

    @Test
    void testUnknownDevice() {
        Properties props = new Properties();
        props.setProperty("wire.device", "watch");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> CompilerOptions.fromProperties(props));
        assertTrue(e.getMessage().contains("watch"));
    }

    @Test
    void testDeviceReachesViewport() {
        Properties props = new Properties();
        props.setProperty("wire.device", "tablet");
        WireCompiler compiler = new WireCompiler(CompilerOptions.fromProperties(props));

        var document = compiler.compile("project \"A\" { screen Main { layout stack { component Divider } } }").orThrow();
        assertEquals(768, document.project().screens().get(0).viewport().width());
    }
}
