package nl.nfi.djlcfrs.common.ini;

import java.util.List;

public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public boolean hasKey(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key) {
        return iniConfig.getString(section, key);
    }

    public String getString(final String key, final String defaultValue) {
        return hasKey(key) ? getString(key) : defaultValue;
    }

    public int getInt(final String key, final int defaultValue) {
        return hasKey(key) ? iniConfig.getInt(section, key) : defaultValue;
    }

    public List<String> getStringList(final String key, final List<String> defaultValue) {
        return hasKey(key) ? iniConfig.getStringList(section, key) : defaultValue;
    }
}
