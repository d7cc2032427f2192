package com.propertyBot.ratingsBot.orchestrator.model;

import com.propertyBot.ratingsBot.delivery.model.MenuButton;

import java.util.List;

/**
 * The 3x2 inline keyboard shown with the welcome and menu messages.
 */
public final class MainMenu {

    private static final List<List<MenuButton>> KEYBOARD = List.of(
            List.of(button(MenuAction.TOP5), button(MenuAction.TOP20)),
            List.of(button(MenuAction.RATINGS), button(MenuAction.PROPERTIES)),
            List.of(button(MenuAction.PROPERTY_HELP), button(MenuAction.COMPLAINTS_HELP)));

    private MainMenu() {
    }

    public static List<List<MenuButton>> keyboard() {
        return KEYBOARD;
    }

    private static MenuButton button(MenuAction action) {
        return new MenuButton(action.getLabel(), action.getCallbackData());
    }
}
