package ai.imaginecalendar.voiceworker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceWorkerApplication.class, args);
    }
}
