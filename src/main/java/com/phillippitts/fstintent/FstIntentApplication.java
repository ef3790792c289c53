package com.phillippitts.fstintent;

import com.phillippitts.fstintent.config.properties.GrammarProperties;
import com.phillippitts.fstintent.config.properties.RecognitionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GrammarProperties.class,
        RecognitionProperties.class
})
public class FstIntentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FstIntentApplication.class, args);
    }

}
