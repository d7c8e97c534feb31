package org.livedoc.compiler.expansion;

import com.typesafe.config.ConfigFactory;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.LocalNodePtr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ExpansionSettingsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        ExpansionSettings settings = ExpansionSettings.defaults();

        assertThat(settings.baseClasses()).contains(LiveId.of("Component"), LiveId.of("Enum"));
        assertThat(settings.componentClass()).isEqualTo(LiveId.of("Component"));
    }

    @Test
    void fromConfigReadsOverrides() {
        ExpansionSettings settings = ExpansionSettings.fromConfig(ConfigFactory.parseString(
                "livedoc.expansion { base-classes = [Widget], component-class = Widget }"));

        assertThat(settings.isBaseClass(LiveId.of("Widget"))).isTrue();
        assertThat(settings.isBaseClass(LiveId.of("Component"))).isFalse();
        assertThat(settings.componentClass()).isEqualTo(LiveId.of("Widget"));
    }

    @Test
    void unresolvableIds() {
        ExpansionSettings settings = ExpansionSettings.defaults();

        assertThat(settings.isUnresolvable(IdPack.single("Self"))).isTrue();
        assertThat(settings.isUnresolvable(IdPack.single("Component"))).isTrue();
        assertThat(settings.isUnresolvable(IdPack.empty())).isTrue();
        assertThat(settings.isUnresolvable(IdPack.nodePtr(new FileId(0), new LocalNodePtr(0, 0)))).isTrue();
        assertThat(settings.isUnresolvable(IdPack.single("Button"))).isFalse();
        assertThat(settings.isUnresolvable(IdPack.multi(0, 2))).isFalse();
    }
}
