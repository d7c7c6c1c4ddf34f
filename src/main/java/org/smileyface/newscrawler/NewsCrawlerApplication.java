package org.smileyface.newscrawler;

import org.smileyface.newscrawler.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
@EnableScheduling
public class NewsCrawlerApplication {

	public static void main(String[] args) {
		SpringApplication.run(NewsCrawlerApplication.class, args);
	}
}
