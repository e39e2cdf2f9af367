package com.phillippitts.voiceinput;

import com.phillippitts.voiceinput.config.audio.AudioCaptureProperties;
import com.phillippitts.voiceinput.config.dictation.DictationProperties;
import com.phillippitts.voiceinput.config.hotkey.HotkeyProperties;
import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.config.stt.WhisperConfig;
import com.phillippitts.voiceinput.config.typing.TypingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        HotkeyProperties.class,
        AudioCaptureProperties.class,
        ModelProperties.class,
        WhisperConfig.class,
        DictationProperties.class,
        TypingProperties.class
})
public class VoiceInputApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(VoiceInputApplication.class);
        // Robot and clipboard need a non-headless AWT
        app.setHeadless(false);
        app.run(args);
    }

}
