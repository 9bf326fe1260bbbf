package com.aiinpocket.studyquest;

import com.aiinpocket.studyquest.config.GamificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GamificationProperties.class)
public class StudyQuestApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyQuestApplication.class, args);
    }

}
