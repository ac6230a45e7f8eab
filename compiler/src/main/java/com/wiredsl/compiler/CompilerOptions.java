package com.wiredsl.compiler;

import com.wiredsl.compiler.ir.DevicePreset;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for {@link WireCompiler}.
 * <p>
 * Read from {@code wire-compiler.properties} on the classpath when present:
 * <pre>
 * wire.debug=false
 * wire.device=desktop
 * wire.strictUnknownComponents=true
 * </pre>
 */
public record CompilerOptions(boolean debug, DevicePreset defaultDevice, boolean strictUnknownComponents) {

    public static final String RESOURCE = "wire-compiler.properties";

    public static CompilerOptions defaults() {
        return new CompilerOptions(false, DevicePreset.DESKTOP, true);
    }

    /**
     * Load options from the classpath resource, falling back to defaults if it is absent.
     */
    public static CompilerOptions load() {
        Properties props = new Properties();
        try (InputStream in = CompilerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static CompilerOptions fromProperties(Properties props) {
        boolean debug = Boolean.parseBoolean(props.getProperty("wire.debug", "false").trim());
        boolean strict = Boolean.parseBoolean(props.getProperty("wire.strictUnknownComponents", "true").trim());

        String deviceName = props.getProperty("wire.device", "desktop").trim();
        DevicePreset device = DevicePreset.fromName(deviceName);
        if (device == null) {
            throw new IllegalArgumentException("Unknown device preset in wire.device: " + deviceName);
        }
        return new CompilerOptions(debug, device, strict);
    }

    public CompilerOptions withDebug(boolean debug) {
        return new CompilerOptions(debug, defaultDevice, strictUnknownComponents);
    }

    public CompilerOptions withStrictUnknownComponents(boolean strict) {
        return new CompilerOptions(debug, defaultDevice, strict);
    }
}
