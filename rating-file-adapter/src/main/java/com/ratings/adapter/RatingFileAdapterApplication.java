package com.ratings.adapter;

import com.ratings.adapter.config.RatingEngineProperties;
import com.ratings.adapter.config.RatingInputProperties;
import com.ratings.adapter.config.RatingOutputProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RatingEngineProperties.class,
        RatingInputProperties.class,
        RatingOutputProperties.class
})
public class RatingFileAdapterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RatingFileAdapterApplication.class, args);
    }
}
