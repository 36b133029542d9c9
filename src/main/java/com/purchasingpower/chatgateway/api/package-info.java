/**
 * REST API layer for chat completions.
 *
 * <p>{@code POST /api/v1/chat/completions} accepts
 * {@code {messages, model?, temperature?, max_tokens?}} and always answers with the
 * same envelope: {@code {success, choices:[{message:{role:"assistant", content}}], error?}}
 * plus optional {@code model}, {@code source}, {@code reasoning} and {@code usage}.
 */
package com.purchasingpower.chatgateway.api;
