package com.fastdispatch.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableAlertDispatch {

    /**
     * 是否启动分发循环
     */
    boolean value() default true;
}
