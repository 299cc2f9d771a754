package com.routemq.exchange;

import com.routemq.model.Binding;
import com.routemq.model.RoutingContext;

import java.util.List;

/**
 * Per exchange type tests of a single binding against a published message.
 * Stateless; callers provide any locking around the binding set.
 */
public final class BindingMatcher {

    private BindingMatcher() {
    }

    public static boolean matchesDirect(Binding binding, RoutingContext context) {
        return binding.getExchange().equals(context.getExchangeName())
            && binding.getRoutingKey().equals(context.getRoutingKey());
    }

    public static boolean matchesFanout(Binding binding, RoutingContext context) {
        return binding.getExchange().equals(context.getExchangeName());
    }

    public static boolean matchesTopic(Binding binding, RoutingContext context) {
        return matchesTopic(binding, context, TopicMatcher.split(context.getRoutingKey()));
    }

    /**
     * Variant for callers that split the routing key once for a whole binding set.
     */
    public static boolean matchesTopic(Binding binding, RoutingContext context, List<String> keyWords) {
        return binding.getExchange().equals(context.getExchangeName())
            && TopicMatcher.matches(binding.getPatternWords(), keyWords);
    }

    public static boolean matchesHeaders(Binding binding, RoutingContext context) {
        return binding.getExchange().equals(context.getExchangeName())
            && binding.getHeadersMatcher().matches(context.getHeaders());
    }
}
