package com.socialinsights.tweetcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 트윗 아카이브 적재 애플리케이션 진입점.
 * <p>
 * 러너가 돌려준 종료 코드를 프로세스 종료 코드로 사용한다.
 */
@SpringBootApplication
public class TweetCatalogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TweetCatalogApplication.class, args)));
    }
}
