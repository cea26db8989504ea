package com.github.salilvnair.entityflow.annotation;

import com.github.salilvnair.entityflow.config.EntityFlowAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(EntityFlowAutoConfiguration.class)
public @interface EnableEntityFlow {
}
